package com.example.newsharvester.config;

/**
 * 기존 카테고리 파일을 읽을 수 없을 때의 처리 방식.
 * - SKIP: 해당 카테고리를 이번 실행에서 건너뛰고 파일은 그대로 둡니다.
 * - RESET: 손상된 파일을 백업한 뒤 빈 컬렉션에서 다시 수집합니다.
 */
public enum CorruptStorePolicy {
    SKIP,
    RESET
}
