package com.feedsync.exception;

public class ArticleNotFoundException extends RuntimeException {

    public ArticleNotFoundException(Long articleId) {
        super("Article not found: " + articleId);
    }
}
