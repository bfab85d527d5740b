package com.webharvester.core.crawler;

import java.net.URI;

/** 프런티어 항목: 정규화된 URL + 발견 순번(단조 증가, FIFO 순서의 근거) */
public record FrontierEntry(URI url, long sequence) {}
