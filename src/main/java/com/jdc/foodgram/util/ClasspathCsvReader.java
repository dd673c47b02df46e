package com.jdc.foodgram.util;

import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * 클래스패스의 CSV 파일을 행 단위로 읽는다. 따옴표 안의 쉼표는 구분자로 보지 않는다.
 */
public final class ClasspathCsvReader {

    private static final String SPLIT_OUTSIDE_QUOTES = ",(?=(?:[^\"]*\"[^\"]*\")*[^\"]*$)";

    private ClasspathCsvReader() {
    }

    public static List<String[]> readRows(String location) {
        try (var reader = new BufferedReader(
                new InputStreamReader(
                        new ClassPathResource(location).getInputStream(),
                        StandardCharsets.UTF_8))) {

            return reader.lines()
                    .filter(line -> !line.isBlank())
                    .map(ClasspathCsvReader::parseLine)
                    .toList();

        } catch (IOException e) {
            throw new UncheckedIOException(location + " 로드 실패", e);
        }
    }

    static String[] parseLine(String line) {
        return Arrays.stream(line.split(SPLIT_OUTSIDE_QUOTES, -1))
                .map(part -> part.trim().replace("\"", ""))
                .toArray(String[]::new);
    }
}
