package com.nevis.digest.repository;

public interface KeywordDocumentRepository {

    void upsert(String filePath, String title, String content);
}
