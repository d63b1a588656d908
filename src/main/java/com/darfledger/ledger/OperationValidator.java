package com.darfledger.ledger;

import com.darfledger.domain.model.Operation;
import com.darfledger.exception.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Checks the Bean Validation constraints declared on {@link Operation} before it may enter
 * the ledger: positive quantity and unit price, non-negative total cost, a non-blank asset
 * code, every enum present and a date.
 */
@Component
public class OperationValidator {

    private final Validator validator;

    public OperationValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * @throws ValidationException listing every violated field in its details
     */
    public void validate(Operation operation) {
        if (operation == null) {
            throw new ValidationException("Operation must not be null");
        }
        Set<ConstraintViolation<Operation>> violations = validator.validate(operation);
        if (violations.isEmpty()) {
            return;
        }

        Map<String, Object> details = new TreeMap<>();
        violations.forEach(v -> details.put(v.getPropertyPath().toString(), v.getMessage()));
        throw new ValidationException(
                String.format(
                        "Invalid operation %s (%s): %s",
                        operation.getId(), operation.getAssetCode(), String.join(", ", details.keySet())),
                details);
    }
}
