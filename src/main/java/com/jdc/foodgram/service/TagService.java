package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.tag.TagDto;
import com.jdc.foodgram.domain.entity.Tag;
import com.jdc.foodgram.domain.repository.TagRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.TagMapper;
import com.jdc.foodgram.util.ClasspathCsvReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class TagService {

    private static final Pattern COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}$");
    private static final Pattern SLUG = Pattern.compile("^[-a-zA-Z0-9_]+$");

    private final TagRepository tagRepository;

    @Transactional(readOnly = true)
    public List<TagDto> getAllTags() {
        return tagRepository.findAllByOrderByNameAsc().stream()
                .map(TagMapper::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public TagDto getTag(Long id) {
        return tagRepository.findById(id)
                .map(TagMapper::toDto)
                .orElseThrow(() -> new CustomException(ErrorCode.TAG_NOT_FOUND));
    }

    /**
     * "이름,slug,#RRGGBB" 형식의 CSV 를 적재한다. 이미 있는 slug 와 형식이 잘못된 행은 건너뛴다.
     *
     * @return 새로 추가된 태그 수
     */
    @Transactional
    public int importFromClasspath(String location) {
        Set<String> names = new HashSet<>();
        Set<String> slugs = new HashSet<>();
        tagRepository.findAll().forEach(t -> {
            names.add(t.getName());
            slugs.add(t.getSlug());
        });

        List<Tag> toSave = new ArrayList<>();
        for (String[] row : ClasspathCsvReader.readRows(location)) {
            if (row.length < 3 || !SLUG.matcher(row[1]).matches() || !COLOR.matcher(row[2]).matches()) {
                log.warn("태그 CSV 형식 오류로 건너뜀: {}", String.join(",", row));
                continue;
            }
            if (names.contains(row[0]) || !slugs.add(row[1])) {
                continue;
            }
            names.add(row[0]);
            toSave.add(Tag.builder().name(row[0]).slug(row[1]).color(row[2].toUpperCase(Locale.ROOT)).build());
        }

        tagRepository.saveAll(toSave);
        log.info("태그 적재: {} 에서 {}건 추가", location, toSave.size());
        return toSave.size();
    }
}
