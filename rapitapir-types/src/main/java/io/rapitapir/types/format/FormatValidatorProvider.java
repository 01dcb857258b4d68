package io.rapitapir.types.format;

import java.util.Collection;

/**
 * Contributes {@link FormatValidator}s.\n
 *
 * Providers are listed in {@code META-INF/rapitapir.factories} under this interface's name.\n
 * When two providers register the same name, the first discovered wins.\n
 */
public interface FormatValidatorProvider {
  Collection<FormatValidator> formatValidators();
}
