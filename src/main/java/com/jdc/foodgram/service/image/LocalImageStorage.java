package com.jdc.foodgram.service.image;

import com.jdc.foodgram.config.StorageProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class LocalImageStorage implements ImageStorage {

    private final StorageProperties storageProperties;

    @Override
    public String store(byte[] content, String extension, String directory) {
        try {
            Path destinationDir = storageProperties.rootPath().resolve(directory);
            if (!Files.exists(destinationDir)) {
                Files.createDirectories(destinationDir);
            }

            String fileName = UUID.randomUUID() + "." + extension;
            Files.write(destinationDir.resolve(fileName), content);

            return urlPrefix() + directory + "/" + fileName;
        } catch (IOException e) {
            throw new UncheckedIOException("이미지를 저장하지 못했습니다: " + directory, e);
        }
    }

    @Override
    public boolean delete(String url) {
        if (url == null || !url.startsWith(urlPrefix())) {
            log.warn("로컬 저장소 URL 이 아니므로 삭제하지 않음: {}", url);
            return false;
        }

        Path root = storageProperties.rootPath();
        Path file = root.resolve(url.substring(urlPrefix().length())).normalize();
        if (!file.startsWith(root)) {
            log.warn("저장소 밖의 경로 삭제 요청 무시: {}", url);
            return false;
        }

        try {
            boolean deleted = Files.deleteIfExists(file);
            if (!deleted) {
                log.warn("삭제할 이미지 파일이 없음: {}", file);
            }
            return deleted;
        } catch (IOException e) {
            // 레코드 삭제는 계속 진행하고 파일만 남긴다
            log.error("이미지 파일 삭제 실패: {}", file, e);
            return false;
        }
    }

    private String urlPrefix() {
        String prefix = storageProperties.getUrlPrefix();
        return prefix.endsWith("/") ? prefix : prefix + "/";
    }
}
