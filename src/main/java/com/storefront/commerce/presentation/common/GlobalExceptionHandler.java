package com.storefront.commerce.presentation.common;

import com.storefront.commerce.common.exception.BizException;
import com.storefront.commerce.common.exception.ErrorCode;
import com.storefront.commerce.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 역할:
 * - 모든 계층에서 발생하는 예외를 잡아서 통일된 에러 응답으로 변환
 *
 * HTTP 상태 코드 매핑:
 * - BizException: ErrorCode에 정의된 상태 코드 (400 / 404 / 500 / 503)
 * - 필수 헤더(X-USER-ID) 누락, 본문/파라미터 형식 오류: 400
 * - DataAccessException: 500 (SYSTEM_DATABASE_ERROR)
 * - 그 외: 500 (SYSTEM_INTERNAL_SERVER_ERROR)
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 비즈니스 예외 (Domain / Application / System)
     */
    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        if (e.getStatusCode() >= 500) {
            logger.error("[GlobalExceptionHandler] {} - {}", e.getErrorCodeValue(), e.getMessage(), e);
        } else {
            logger.warn("[GlobalExceptionHandler] {} - {}", e.getErrorCodeValue(), e.getMessage());
        }
        ErrorResponse errorResponse = ErrorResponse.of(e.getErrorCodeValue(), e.getMessage());
        return ResponseEntity.status(e.getStatusCode()).body(errorResponse);
    }

    /**
     * 필수 헤더 누락 (400) - X-USER-ID, Idempotency-Key 형식 등
     */
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingRequestHeader(MissingRequestHeaderException e) {
        return badRequest(e.getHeaderName() + " 헤더는 필수입니다");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return badRequest(e.getParameterName() + " 파라미터는 필수입니다");
    }

    /**
     * 경로 변수/파라미터/헤더 타입 변환 실패 (400) - 예: X-USER-ID=abc
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return badRequest(e.getName() + " 값의 형식이 올바르지 않습니다");
    }

    /**
     * 요청 본문 JSON 파싱 실패 (400)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleNotReadable(HttpMessageNotReadableException e) {
        return badRequest("요청 본문을 읽을 수 없습니다");
    }

    /**
     * 데이터베이스 오류 (500)
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException e) {
        logger.error("[GlobalExceptionHandler] 데이터베이스 오류: ", e);
        ErrorResponse errorResponse = ErrorResponse.of(
                ErrorCode.DATABASE_ERROR.getCode(), ErrorCode.DATABASE_ERROR.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    /**
     * 서버 내부 오류 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unhandled exception occurred: ", e);
        ErrorResponse errorResponse = ErrorResponse.of(
                ErrorCode.INTERNAL_SERVER_ERROR.getCode(), ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private ResponseEntity<ErrorResponse> badRequest(String detail) {
        ErrorResponse errorResponse = ErrorResponse.of(
                ErrorCode.INVALID_REQUEST.getCode(),
                ErrorCode.INVALID_REQUEST.getMessage() + " | " + detail);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }
}
