package com.graphqldemo.common.validation;

import com.graphqldemo.auth.exception.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 对输入对象执行 Bean Validation，并把全部违规按字段聚合后一次性抛出。
 */
@Component
@RequiredArgsConstructor
public class InputValidator {

    private final Validator validator;

    /**
     * @param input 待校验对象。
     * @throws ValidationException 存在任一违规时抛出，包含所有字段的全部信息。
     */
    public <T> void validate(T input) {
        Set<ConstraintViolation<T>> violations = validator.validate(input);
        if (violations.isEmpty()) {
            return;
        }
        Map<String, List<String>> errors = new TreeMap<>();
        for (ConstraintViolation<T> violation : violations) {
            errors.computeIfAbsent(violation.getPropertyPath().toString(), k -> new ArrayList<>())
                    .add(violation.getMessage());
        }
        errors.values().forEach(Collections::sort);
        throw new ValidationException(errors);
    }
}
