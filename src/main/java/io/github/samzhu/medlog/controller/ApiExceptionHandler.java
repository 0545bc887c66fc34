package io.github.samzhu.medlog.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.fasterxml.jackson.databind.JsonMappingException;

import io.github.samzhu.medlog.dto.api.ErrorResponse;
import io.github.samzhu.medlog.exception.AdminAccessDeniedException;
import io.github.samzhu.medlog.exception.CodeGenerationException;
import io.github.samzhu.medlog.exception.StorageException;
import io.github.samzhu.medlog.exception.UnauthorizedException;

/**
 * 將例外轉為 {@code {"error": "..."}} 回應。
 *
 * <p>巢狀欄位的驗證錯誤格式為 {@code Validation error in '<field>': <message>}；
 * 請求頂層欄位（例如 {@code code}、{@code log}）直接回傳訊息本身。
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final String CROSS_FIELD_CONSTRAINT = "AssertTrue";

    @ExceptionHandler(UnauthorizedException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public ErrorResponse handleUnauthorized(UnauthorizedException e) {
        log.debug("Unauthorized request: {}", e.getMessage());
        return new ErrorResponse(e.getMessage());
    }

    @ExceptionHandler(AdminAccessDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public ErrorResponse handleAdminAccessDenied(AdminAccessDeniedException e) {
        return new ErrorResponse(e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleValidation(MethodArgumentNotValidException e) {
        List<FieldError> fieldErrors = e.getBindingResult().getFieldErrors();
        if (fieldErrors.isEmpty()) {
            List<ObjectError> globalErrors = e.getBindingResult().getGlobalErrors();
            String message = globalErrors.isEmpty() ? "Invalid request" : globalErrors.get(0).getDefaultMessage();
            return new ErrorResponse(message);
        }
        FieldError error = fieldErrors.get(0);
        String path = error.getField();
        int lastDot = path.lastIndexOf('.');
        if (lastDot < 0) {
            return new ErrorResponse(error.getDefaultMessage());
        }
        // 跨欄位檢查掛在合成屬性上，回報其所屬物件
        String field = CROSS_FIELD_CONSTRAINT.equals(error.getCode())
            ? leafOf(path.substring(0, lastDot))
            : path.substring(lastDot + 1);
        return validationError(field, error.getDefaultMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleNotReadable(HttpMessageNotReadableException e) {
        if (e.getCause() instanceof JsonMappingException) {
            JsonMappingException mapping = (JsonMappingException) e.getCause();
            List<JsonMappingException.Reference> path = mapping.getPath();
            if (!path.isEmpty() && path.get(path.size() - 1).getFieldName() != null) {
                String field = path.get(path.size() - 1).getFieldName();
                Throwable root = e.getMostSpecificCause();
                String message = root instanceof IllegalArgumentException
                    ? root.getMessage()
                    : "invalid value for this field";
                return validationError(field, message);
            }
        }
        log.debug("Unreadable request body: {}", e.getMessage());
        return new ErrorResponse("Malformed JSON request body");
    }

    @ExceptionHandler(CodeGenerationException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ErrorResponse handleCodeGeneration(CodeGenerationException e) {
        log.error("Code generation exhausted after {} attempts", e.getAttempts());
        return new ErrorResponse(e.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleStorage(StorageException e) {
        log.error("Storage failure: file={}", e.getDataFile(), e);
        return new ErrorResponse("Storage unavailable");
    }

    private static ErrorResponse validationError(String field, String message) {
        return new ErrorResponse(String.format("Validation error in '%s': %s", field, message));
    }

    private static String leafOf(String path) {
        return path.substring(path.lastIndexOf('.') + 1);
    }
}
