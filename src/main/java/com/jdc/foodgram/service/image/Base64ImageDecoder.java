package com.jdc.foodgram.service.image;

import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "data:image/&lt;ext&gt;;base64,&lt;payload&gt;" 형식의 문자열을 바이트로 변환한다.
 */
@Component
public class Base64ImageDecoder {

    private static final Pattern DATA_URI = Pattern.compile("^data:image/([a-zA-Z0-9.+-]+);base64,(.+)$", Pattern.DOTALL);
    private static final Set<String> ALLOWED_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "webp", "bmp");

    public DecodedImage decode(String dataUri, String field) {
        if (dataUri == null || dataUri.isBlank()) {
            throw new CustomException(ErrorCode.INVALID_IMAGE_ENCODING, "이미지 데이터가 비어 있습니다.", field);
        }

        Matcher matcher = DATA_URI.matcher(dataUri.trim());
        if (!matcher.matches()) {
            throw new CustomException(ErrorCode.INVALID_IMAGE_ENCODING,
                    "이미지는 data:image/<확장자>;base64, 형식이어야 합니다.", field);
        }

        String extension = matcher.group(1).toLowerCase(Locale.ROOT);
        if (!ALLOWED_EXTENSIONS.contains(extension)) {
            throw new CustomException(ErrorCode.INVALID_IMAGE_ENCODING,
                    "지원하지 않는 이미지 형식입니다: " + extension, field);
        }

        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(matcher.group(2).replaceAll("\\s", ""));
        } catch (IllegalArgumentException e) {
            throw new CustomException(ErrorCode.INVALID_IMAGE_ENCODING, "Base64 디코딩에 실패했습니다.", field);
        }
        if (bytes.length == 0) {
            throw new CustomException(ErrorCode.INVALID_IMAGE_ENCODING, "이미지 데이터가 비어 있습니다.", field);
        }

        return new DecodedImage(bytes, "jpeg".equals(extension) ? "jpg" : extension);
    }

    public record DecodedImage(byte[] content, String extension) {
    }
}
