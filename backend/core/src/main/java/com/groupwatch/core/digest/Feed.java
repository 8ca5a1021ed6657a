package com.groupwatch.core.digest;

import com.groupwatch.core.model.Article;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class Feed implements Digest {
    private final String title;
    private final List<Article> articles = new ArrayList<>();

    public Feed(String title) {
        this.title = Objects.requireNonNull(title, "title is required");
    }

    public void append(Article article) {
        articles.add(Objects.requireNonNull(article, "article is required"));
    }

    public List<Article> articles() {
        return Collections.unmodifiableList(articles);
    }

    @Override
    public String title() {
        return title;
    }

    @Override
    public int size() {
        return articles.size();
    }

    @Override
    public String summary() {
        return articles.size() + (articles.size() == 1 ? " new article" : " new articles");
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
        return "Feed[" + title + ", articles=" + articles.size() + "]";
    }
}
