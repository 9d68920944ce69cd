package io.gigdraft;

/**
 * Supplies the employer a published posting belongs to. Never taken from the form.
 */
@FunctionalInterface
public interface EmployerIdProvider {

    EmployerIdProvider NONE = () -> null;

    String currentEmployerId();
}
