package com.groupwatch.core.digest;

import com.groupwatch.core.model.Post;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class Subreddit implements Digest {
    private final String name;
    private final List<Post> posts = new ArrayList<>();

    public Subreddit(String name) {
        this.name = Objects.requireNonNull(name, "name is required");
    }

    public String name() {
        return name;
    }

    public void append(Post post) {
        posts.add(Objects.requireNonNull(post, "post is required"));
    }

    public List<Post> posts() {
        return Collections.unmodifiableList(posts);
    }

    @Override
    public String title() {
        return "r/" + name;
    }

    @Override
    public int size() {
        return posts.size();
    }

    @Override
    public String summary() {
        return posts.size() + (posts.size() == 1 ? " new post" : " new posts");
    }

    @Override
    public String renderText(DigestRenderer renderer) {
        return renderer.renderText(this);
    }

    @Override
    public String renderHtml(DigestRenderer renderer) {
        return renderer.renderHtml(this);
    }

    @Override
    public String toString() {
        return "Subreddit[" + name + ", posts=" + posts.size() + "]";
    }
}
