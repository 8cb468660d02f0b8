package dev.visibility.model;

public enum BusinessStatus {
    PENDING,
    CRAWLING,
    CRAWLED,
    GENERATING,
    PUBLISHED,
    ERROR
}
