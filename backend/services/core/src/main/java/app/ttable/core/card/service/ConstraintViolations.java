package app.ttable.core.card.service;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Locale;

final class ConstraintViolations {

    private ConstraintViolations() {
    }

    // имя индекса берём из Hibernate, текст ошибки базы не разбираем
    static boolean violates(DataIntegrityViolationException ex, String indexName) {
        Throwable cause = ex.getCause();
        if (cause instanceof ConstraintViolationException) {
            String constraint = ((ConstraintViolationException) cause).getConstraintName();
            return constraint != null && constraint.toLowerCase(Locale.ROOT).contains(indexName);
        }
        return false;
    }
}
