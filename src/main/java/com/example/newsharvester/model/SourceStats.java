package com.example.newsharvester.model;

/**
 * 병합 시 원본 컬렉션 하나에 대한 통계: 원래 기사 수와 병합 결과에 새로 기여한 기사 수.
 */
public class SourceStats {
    private final String source;
    private final int originalCount;
    private final int uniqueCount;

    public SourceStats(String source, int originalCount, int uniqueCount) {
        this.source = source;
        this.originalCount = originalCount;
        this.uniqueCount = uniqueCount;
    }

    public String getSource() {
        return source;
    }
    public int getOriginalCount() {
        return originalCount;
    }
    public int getUniqueCount() {
        return uniqueCount;
    }
    public int getDuplicateCount() {
        return originalCount - uniqueCount;
    }
}
