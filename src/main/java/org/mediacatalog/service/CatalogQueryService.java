package org.mediacatalog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediacatalog.dto.ContentFilter;
import org.mediacatalog.entity.CatalogRecord;
import org.mediacatalog.exception.NotFoundException;
import org.mediacatalog.exception.ValidationException;
import org.mediacatalog.repository.CatalogRecordRepository;
import org.mediacatalog.repository.CatalogRecordSpecifications;
import org.mediacatalog.repository.OffsetLimitRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Чтение каталога: фильтры, поиск по подстроке и пагинация.
 * Записи возвращаются в порядке добавления (по внутреннему id).
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CatalogQueryService {
    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private static final Sort INSERTION_ORDER = Sort.by(Sort.Direction.ASC, "id");

    private final CatalogRecordRepository catalogRecordRepository;

    public List<CatalogRecord> findContent(ContentFilter filter, int limit, int offset) {
        return page(CatalogRecordSpecifications.fromFilter(filter), limit, offset);
    }

    public List<CatalogRecord> search(String query, int limit, int offset) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("q", "Поисковый запрос не может быть пустым");
        }
        log.debug("Поиск по запросу '{}' (limit={}, offset={})", query, limit, offset);
        return page(CatalogRecordSpecifications.matchesText(query), limit, offset);
    }

    public CatalogRecord getById(Long id) {
        return catalogRecordRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Контент не найден"));
    }

    public List<CatalogRecord> findByRating(String rating, int limit, int offset) {
        return findContent(ContentFilter.builder().rating(rating).build(), limit, offset);
    }

    public List<CatalogRecord> findByCategory(String category, int limit, int offset) {
        return findContent(ContentFilter.builder().category(category).build(), limit, offset);
    }

    private List<CatalogRecord> page(Specification<CatalogRecord> specification, int limit, int offset) {
        checkPaging(limit, offset);
        return catalogRecordRepository.findAll(specification, new OffsetLimitRequest(offset, limit, INSERTION_ORDER))
                .getContent();
    }

    private static void checkPaging(int limit, int offset) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit", "limit должен быть в диапазоне от 1 до " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new ValidationException("offset", "offset не может быть отрицательным");
        }
    }
}
