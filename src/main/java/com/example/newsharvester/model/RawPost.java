package com.example.newsharvester.model;

/**
 * 원격 API가 돌려준 게시물 한 건. 본문은 아직 정제되지 않은 HTML입니다.
 */
public class RawPost {
    private final Long id;
    private final String link;
    private final String renderedTitle;
    private final String renderedContent;

    public RawPost(Long id, String link, String renderedTitle, String renderedContent) {
        this.id = id;
        this.link = link;
        this.renderedTitle = renderedTitle;
        this.renderedContent = renderedContent;
    }

    public Long getId() {
        return id;
    }
    public String getLink() {
        return link;
    }
    public String getRenderedTitle() {
        return renderedTitle;
    }
    public String getRenderedContent() {
        return renderedContent;
    }
}
