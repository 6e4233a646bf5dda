package io.b2mash.propertysync.sync;

import io.b2mash.propertysync.exception.InvalidStateException;
import io.b2mash.propertysync.schema.CanonicalRecord;
import io.b2mash.propertysync.schema.EntityKind;
import io.b2mash.propertysync.transform.EntityTransformer;
import io.b2mash.propertysync.validation.EntityValidator;
import io.b2mash.propertysync.validation.ValidationResult;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for form submissions: transforms raw form state into a canonical record and
 * validates it with the transformer and validator registered for the entity kind.
 */
@Service
public class FormSyncService {

  private static final Logger log = LoggerFactory.getLogger(FormSyncService.class);

  private final Map<EntityKind, EntityTransformer> transformers;
  private final Map<EntityKind, EntityValidator> validators;

  public FormSyncService(List<EntityTransformer> transformers, List<EntityValidator> validators) {
    this.transformers =
        transformers.stream()
            .collect(
                Collectors.toMap(
                    EntityTransformer::supports,
                    Function.identity(),
                    (existing, duplicate) -> {
                      throw new IllegalStateException(
                          "Duplicate transformer for "
                              + existing.supports()
                              + ": "
                              + existing.getClass().getSimpleName()
                              + " and "
                              + duplicate.getClass().getSimpleName());
                    },
                    () -> new EnumMap<EntityKind, EntityTransformer>(EntityKind.class)));
    this.validators =
        validators.stream()
            .collect(
                Collectors.toMap(
                    EntityValidator::supports,
                    Function.identity(),
                    (existing, duplicate) -> {
                      throw new IllegalStateException(
                          "Duplicate validator for "
                              + existing.supports()
                              + ": "
                              + existing.getClass().getSimpleName()
                              + " and "
                              + duplicate.getClass().getSimpleName());
                    },
                    () -> new EnumMap<EntityKind, EntityValidator>(EntityKind.class)));
  }

  public SyncResult synchronize(EntityKind kind, Map<String, ?> rawInput) {
    var record = transformerFor(kind).transform(rawInput);
    var validation = validatorFor(kind).validate(record);
    if (!validation.valid()) {
      log.debug(
          "{} record rejected: missing={}, errors={}",
          kind,
          validation.missingRequired(),
          validation.errors());
    }
    return new SyncResult(record, validation);
  }

  /**
   * Returns the canonical record only if it would be accepted by the backend.
   *
   * @throws InvalidStateException listing every missing and rejected field
   */
  public CanonicalRecord requireValid(EntityKind kind, Map<String, ?> rawInput) {
    var result = synchronize(kind, rawInput);
    if (!result.isValid()) {
      var validation = result.validation();
      throw new InvalidStateException(
          "Invalid " + kind.getDisplayLabel(),
          describe(validation),
          validation.errors());
    }
    return result.record();
  }

  public Map<String, Object> toFormState(EntityKind kind, CanonicalRecord record) {
    return transformerFor(kind).toFormState(record);
  }

  private EntityTransformer transformerFor(EntityKind kind) {
    var transformer = transformers.get(kind);
    if (transformer == null) {
      throw new IllegalArgumentException("No transformer registered for " + kind);
    }
    return transformer;
  }

  private EntityValidator validatorFor(EntityKind kind) {
    var validator = validators.get(kind);
    if (validator == null) {
      throw new IllegalArgumentException("No validator registered for " + kind);
    }
    return validator;
  }

  private static String describe(ValidationResult validation) {
    int problems = validation.errors().size();
    if (!validation.missingRequired().isEmpty()) {
      return "Missing required fields: " + String.join(", ", validation.missingRequired());
    }
    return problems + (problems == 1 ? " field is" : " fields are") + " invalid";
  }
}
