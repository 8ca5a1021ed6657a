package com.groupwatch.service.config;

import java.util.List;

/**
 * @param groupName shown in brackets at the start of every subject line
 */
public record SmtpConfig(
        boolean enabled,
        String host,
        int port,
        String username,
        String password,
        String from,
        List<String> to,
        boolean startTls,
        String groupName
) {
    public SmtpConfig {
        host = host == null || host.isBlank() ? "localhost" : host;
        port = port <= 0 ? 587 : port;
        username = username == null ? "" : username;
        password = password == null ? "" : password;
        from = from == null || from.isBlank() ? username : from;
        to = to == null ? List.of() : List.copyOf(to);
        groupName = groupName == null || groupName.isBlank() ? "group-watch" : groupName;
    }

    public SmtpConfig withPassword(String override) {
        return new SmtpConfig(enabled, host, port, username, override, from, to, startTls, groupName);
    }
}
