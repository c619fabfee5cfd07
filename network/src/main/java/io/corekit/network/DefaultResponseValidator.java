package io.corekit.network;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.corekit.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps HTTP statuses to {@link NetworkError}s:
 * <ul>
 *   <li>200-299 - success</li>
 *   <li>400 - {@link NetworkError.Kind#BAD_REQUEST} with the {@link ApiError} decoded from the body,
 *       if it parses</li>
 *   <li>401 - {@link NetworkError.Kind#UNAUTHORIZED}</li>
 *   <li>403 - {@link NetworkError.Kind#FORBIDDEN}</li>
 *   <li>404 - {@link NetworkError.Kind#NOT_FOUND}</li>
 *   <li>500-599 - {@link NetworkError.Kind#SERVER_ERROR}</li>
 *   <li>any other status - {@link NetworkError.Kind#UNEXPECTED_STATUS_CODE}</li>
 * </ul>
 * A missing response, or a status outside 100-599, is {@link NetworkError.Kind#INVALID_RESPONSE}.
 */
public class DefaultResponseValidator implements ResponseValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultResponseValidator.class);

    private final ObjectMapper objectMapper;

    public DefaultResponseValidator() {
        this(Utils.SNAKE_CASE_MAPPER);
    }

    public DefaultResponseValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void validate(@Nullable String body, @Nullable Response response) throws NetworkError {
        if (response == null) {
            throw NetworkError.invalidResponse();
        }

        int status = response.statusCode();
        if (status < 100 || status > 599) {
            throw NetworkError.invalidResponse();
        }
        if (status >= 200 && status <= 299) {
            return;
        }
        switch (status) {
            case 400 -> throw NetworkError.badRequest(decodeApiError(body));
            case 401 -> throw NetworkError.unauthorized();
            case 403 -> throw NetworkError.forbidden();
            case 404 -> throw NetworkError.notFound();
            default -> {
                if (status >= 500) {
                    throw NetworkError.serverError(status);
                }
                throw NetworkError.unexpectedStatusCode(status);
            }
        }
    }

    private @Nullable ApiError decodeApiError(@Nullable String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            ApiError apiError = objectMapper.readValue(body, ApiError.class);
            return apiError != null && (apiError.code() != null || apiError.message() != null) ? apiError : null;
        } catch (JsonProcessingException e) {
            LOGGER.debug("Bad request body is not an API error: {}", e.getOriginalMessage());
            return null;
        }
    }
}
