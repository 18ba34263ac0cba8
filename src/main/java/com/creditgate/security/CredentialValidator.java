package com.creditgate.security;

import com.creditgate.shared.model.ApiKey;

/**
 * Resolves and validates the credential presented with a gated request.
 */
public interface CredentialValidator {

    /**
     * Resolves a raw key to its stored credential.
     * @throws InvalidCredentialException if the key is missing, malformed or unknown
     */
    ApiKey resolve(String rawKey);

    /**
     * Checks that a resolved credential may perform an operation needing the given scope.
     * @throws ExpiredCredentialException if the credential has expired
     * @throws ForbiddenCredentialException if it is disabled or lacks the scope
     */
    void validate(ApiKey credential, String requiredScope);
}
