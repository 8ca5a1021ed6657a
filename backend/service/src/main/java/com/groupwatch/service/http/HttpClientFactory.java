package com.groupwatch.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the single HTTP client shared by the collectors and the Telegram sender. Redirects are followed because
 * list archives and Reddit answer moved pages with 301s. A custom truststore can be supplied through
 * {@code TRUSTSTORE_PATH} and {@code TRUSTSTORE_PASSWORD}.
 */
public final class HttpClientFactory {
    static final String TRUSTSTORE_PATH_ENV = "TRUSTSTORE_PATH";
    static final String TRUSTSTORE_PASSWORD_ENV = "TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> env) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        String truststore = env.get(TRUSTSTORE_PATH_ENV);
        if (truststore != null && !truststore.isBlank()) {
            builder.sslContext(sslContext(Path.of(truststore), env.get(TRUSTSTORE_PASSWORD_ENV)));
        }
        return builder.build();
    }

    private static SSLContext sslContext(Path path, String password) {
        if (password == null) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD_ENV + " must be set when " + TRUSTSTORE_PATH_ENV + " is configured");
        }
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(storeType(path));
            trustStore.load(in, password.toCharArray());

            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(trustStore);

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), new SecureRandom());
            return context;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    private static String storeType(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".p12") || name.endsWith(".pfx") ? "PKCS12" : "JKS";
    }
}
