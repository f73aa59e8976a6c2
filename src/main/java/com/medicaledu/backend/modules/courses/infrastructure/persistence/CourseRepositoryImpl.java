package com.medicaledu.backend.modules.courses.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.modules.courses.domain.Course;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Repository
public class CourseRepositoryImpl implements CourseRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<Course> searchCourses(CourseSearchCondition condition, Pageable pageable) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(pageable, "pageable must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (condition.published() != null) {
            whereClauses.add("c.published = :published");
            params.put("published", condition.published());
        }
        if (condition.active() != null) {
            whereClauses.add(condition.active() ? "c.deletedAt is null" : "c.deletedAt is not null");
        }
        if (condition.instructorId() != null) {
            whereClauses.add("c.instructorId = :instructorId");
            params.put("instructorId", condition.instructorId());
        }
        if (StringUtils.hasText(condition.titleContains())) {
            whereClauses.add("lower(c.title) like :title");
            params.put("title", likePattern(condition.titleContains()));
        }
        if (StringUtils.hasText(condition.descriptionContains())) {
            whereClauses.add("lower(c.description) like :description");
            params.put("description", likePattern(condition.descriptionContains()));
        }
        if (condition.category() != null) {
            whereClauses.add("c.category = :category");
            params.put("category", condition.category());
        }
        if (condition.minPrice() != null) {
            whereClauses.add("c.price.amount >= :minPrice");
            params.put("minPrice", condition.minPrice());
        }
        if (condition.maxPrice() != null) {
            whereClauses.add("c.price.amount <= :maxPrice");
            params.put("maxPrice", condition.maxPrice());
        }
        if (StringUtils.hasText(condition.currency())) {
            whereClauses.add("c.price.currency = :currency");
            params.put("currency", Currency.of(condition.currency()));
        }
        if (condition.createdFrom() != null) {
            whereClauses.add("c.createdAt >= :createdFrom");
            params.put("createdFrom", condition.createdFrom());
        }
        if (condition.createdTo() != null) {
            whereClauses.add("c.createdAt <= :createdTo");
            params.put("createdTo", condition.createdTo());
        }
        if (condition.publishedFrom() != null) {
            whereClauses.add("c.publishedAt >= :publishedFrom");
            params.put("publishedFrom", condition.publishedFrom());
        }
        if (condition.publishedTo() != null) {
            whereClauses.add("c.publishedAt <= :publishedTo");
            params.put("publishedTo", condition.publishedTo());
        }
        if (condition.minDuration() != null) {
            whereClauses.add("c.durationMinutes >= :minDuration");
            params.put("minDuration", condition.minDuration());
        }
        if (condition.maxDuration() != null) {
            whereClauses.add("c.durationMinutes <= :maxDuration");
            params.put("maxDuration", condition.maxDuration());
        }
        if (condition.minMaxStudents() != null) {
            whereClauses.add("c.maxStudents >= :minMaxStudents");
            params.put("minMaxStudents", condition.minMaxStudents());
        }
        if (condition.maxMaxStudents() != null) {
            whereClauses.add("c.maxStudents <= :maxMaxStudents");
            params.put("maxMaxStudents", condition.maxMaxStudents());
        }

        String whereJpql = whereClauses.isEmpty() ? "" : " where " + String.join(" and ", whereClauses);

        TypedQuery<Long> countQuery = entityManager.createQuery("select count(c) from Course c" + whereJpql, Long.class);
        params.forEach(countQuery::setParameter);
        long total = countQuery.getSingleResult();
        if (total == 0) {
            return new PageImpl<>(List.of(), pageable, 0);
        }

        CourseSortField sortField = condition.sortBy() != null ? condition.sortBy() : CourseSortField.CREATED_AT;
        String direction = condition.sortDirection() == Sort.Direction.ASC ? "asc" : "desc";
        String orderBy = " order by " + sortField.path() + " " + direction + " nulls last, c.id";

        TypedQuery<Course> dataQuery = entityManager.createQuery("select c from Course c" + whereJpql + orderBy, Course.class);
        params.forEach(dataQuery::setParameter);
        dataQuery.setFirstResult((int) pageable.getOffset());
        dataQuery.setMaxResults(pageable.getPageSize());

        return new PageImpl<>(dataQuery.getResultList(), pageable, total);
    }

    private static String likePattern(String value) {
        return "%" + value.trim().toLowerCase(Locale.ROOT) + "%";
    }
}
