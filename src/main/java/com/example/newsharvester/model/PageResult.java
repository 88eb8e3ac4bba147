/**
 * PageResult는 페이지 한 번 요청의 결과를 나타냅니다.
 * - POSTS: 게시물 목록을 받았습니다.
 * - END_OF_PAGINATION: 마지막 페이지를 지났습니다(HTTP 400 또는 빈 목록).
 * - TRANSIENT_ERROR: 네트워크/HTTP/파싱 오류로 이번 실행에서는 해당 카테고리를 더 진행하지 않습니다.
 */

package com.example.newsharvester.model;

import java.util.Collections;
import java.util.List;

public final class PageResult {
    public enum Kind {
        POSTS,
        END_OF_PAGINATION,
        TRANSIENT_ERROR
    }

    private static final PageResult END = new PageResult(Kind.END_OF_PAGINATION, Collections.emptyList(), null);

    private final Kind kind;
    private final List<RawPost> posts;
    private final String reason;

    private PageResult(Kind kind, List<RawPost> posts, String reason) {
        this.kind = kind;
        this.posts = posts;
        this.reason = reason;
    }

    public static PageResult posts(List<RawPost> posts) {
        return new PageResult(Kind.POSTS, List.copyOf(posts), null);
    }

    public static PageResult endOfPagination() {
        return END;
    }

    public static PageResult transientError(String reason) {
        return new PageResult(Kind.TRANSIENT_ERROR, Collections.emptyList(), reason);
    }

    public Kind getKind() {
        return kind;
    }
    public List<RawPost> getPosts() {
        return posts;
    }
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        switch (kind) {
            case POSTS:
                return "Posts(" + posts.size() + ")";
            case TRANSIENT_ERROR:
                return "TransientError(" + reason + ")";
            default:
                return "EndOfPagination";
        }
    }
}
