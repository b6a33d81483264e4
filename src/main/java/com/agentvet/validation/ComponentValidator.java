package com.agentvet.validation;

import com.agentvet.component.Component;

/**
 * A single independent check over a component. Implementations report
 * content defects as findings and never throw for them.
 */
public interface ComponentValidator {

    ValidatorKind kind();

    ValidatorResult validate(Component component, ValidationOptions options);

    default ValidatorResult validate(Component component) {
        return validate(component, ValidationOptions.defaults());
    }
}
