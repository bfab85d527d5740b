package com.webharvester.core.persist;

/** 페이지/기록 쓰기 실패(디스크 부족, 권한 등). 실행을 중단시키는 치명 오류. */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
