package com.example.newsharvester.repository;

/**
 * 기존 카테고리 파일을 읽을 수 없어 해당 카테고리 수집을 중단할 때 던집니다.
 */
public class CorruptStoreFileException extends Exception {
    private final String category;

    public CorruptStoreFileException(String category, String message) {
        super(message);
        this.category = category;
    }

    public String getCategory() {
        return category;
    }
}
