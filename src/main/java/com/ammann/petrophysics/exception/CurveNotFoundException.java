/* (C)2026 */
package com.ammann.petrophysics.exception;

import java.util.Collection;

/**
 * Raised when none of the names of a logical curve alias resolves in a dataset, or when
 * a requested well is not registered.
 *
 * <p>Mapped to HTTP 404 (Not Found) by {@link GlobalExceptionHandler}.
 */
public class CurveNotFoundException extends ApiException
{
    public CurveNotFoundException(String message)
    {
        super(message);
    }

    public static CurveNotFoundException forAlias(String alias, Collection<String> tried, String wellName)
    {
        return new CurveNotFoundException(
                String.format("No %s curve in well '%s' (tried %s)", alias, wellName, tried));
    }
}
