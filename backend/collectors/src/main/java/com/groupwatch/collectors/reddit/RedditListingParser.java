package com.groupwatch.collectors.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groupwatch.core.model.Post;
import com.groupwatch.core.util.JsonUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps a Reddit listing ({@code {"data":{"children":[{"data":{...}}]}}}) to posts in listing order.
 */
public final class RedditListingParser {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private RedditListingParser() {
    }

    /**
     * @throws IOException if the body is not JSON
     */
    public static List<Post> parse(String json, String baseUrl) throws IOException {
        JsonNode children = MAPPER.readTree(json).path("data").path("children");
        List<Post> posts = new ArrayList<>();
        for (JsonNode child : children) {
            JsonNode data = child.path("data");
            String title = data.path("title").asText("").trim();
            String url = data.path("url").asText("").trim();
            String permalink = data.path("permalink").asText("").trim();
            if (title.isEmpty() || (url.isEmpty() && permalink.isEmpty())) {
                continue;
            }
            String comments = permalink.isEmpty() ? null : baseUrl + permalink;
            posts.add(new Post(title, url.isEmpty() ? comments : url, data.path("is_self").asBoolean(false), comments));
        }
        return posts;
    }
}
