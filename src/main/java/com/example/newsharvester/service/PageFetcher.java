package com.example.newsharvester.service;

import com.example.newsharvester.model.PageResult;

/**
 * 원격 API에서 카테고리의 한 페이지를 가져옵니다. 구현체는 예외를 던지지 않고
 * 모든 실패를 PageResult.transientError로 돌려줍니다.
 */
public interface PageFetcher {
    PageResult fetchPage(long categoryId, int page);
}
