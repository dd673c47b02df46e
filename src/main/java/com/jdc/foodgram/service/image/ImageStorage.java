package com.jdc.foodgram.service.image;

/**
 * 디코딩된 이미지 바이트를 저장하고 접근 가능한 URL 을 돌려준다.
 */
public interface ImageStorage {

    String store(byte[] content, String extension, String directory);

    boolean delete(String url);
}
