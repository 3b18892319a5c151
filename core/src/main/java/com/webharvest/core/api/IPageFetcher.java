// IPageFetcher.java
package com.webharvest.core.api;

import com.webharvest.core.model.FetchResult;
import java.net.URI;

/** fetch 최소 계약: URL을 받아 본문 또는 분류된 실패를 돌려준다. 예외로 실패를 알리지 않는다. */
public interface IPageFetcher extends AutoCloseable {
    FetchResult fetch(URI url) throws InterruptedException;
    @Override default void close() throws Exception {}
}
