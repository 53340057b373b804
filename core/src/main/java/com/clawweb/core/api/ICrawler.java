// ICrawler.java
package com.clawweb.core.api;

import com.clawweb.core.model.CrawlResult;

/** 크롤러 최소 계약: 한 번 순회하고 결과를 돌려준다. */
public interface ICrawler extends AutoCloseable {
    CrawlResult crawl();
    @Override default void close() throws Exception {}
}
