package com.jdc.foodgram.config;

import lombok.Getter; import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@ConfigurationProperties(prefix = "app.media")
@Getter @Setter
public class StorageProperties {
    /** 업로드 이미지가 저장되는 로컬 디렉터리 */
    private String dir = "./media";
    /** 저장된 파일을 내려줄 URL 접두사 */
    private String urlPrefix = "/media/";
    public Path rootPath() { return Path.of(dir).toAbsolutePath().normalize(); }
}
