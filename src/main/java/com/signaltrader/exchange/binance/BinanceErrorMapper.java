package com.signaltrader.exchange.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signaltrader.exception.ExchangeErrorType;
import com.signaltrader.exception.ExchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

/**
 * Translates RestTemplate failures against Binance into {@link ExchangeException}s.
 *
 * <ul>
 *   <li>HTTP 429/418 and code -1003: RATE_LIMITED</li>
 *   <li>HTTP 5xx, I/O errors, -1007 (backend timeout) and -1021 (clock skew): TRANSIENT.
 *       A 5xx or timeout on order submission means the execution status is unknown.</li>
 *   <li>-2018/-2019 (balance or margin insufficient): INSUFFICIENT_FUNDS</li>
 *   <li>any other 4xx: INVALID_REQUEST</li>
 *   <li>anything else: UNKNOWN</li>
 * </ul>
 */
public class BinanceErrorMapper {

    private static final Logger log = LoggerFactory.getLogger(BinanceErrorMapper.class);

    private final ObjectMapper objectMapper;

    public BinanceErrorMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExchangeException map(String operation, RestClientException exception) {
        if (exception instanceof HttpStatusCodeException httpError) {
            return mapHttp(operation, httpError);
        }
        if (exception instanceof ResourceAccessException) {
            return new ExchangeException(
                    ExchangeErrorType.TRANSIENT, operation + " I/O failure: " + exception.getMessage(), exception);
        }
        return new ExchangeException(
                ExchangeErrorType.UNKNOWN, operation + " failed: " + exception.getMessage(), exception);
    }

    private BinanceApiException mapHttp(String operation, HttpStatusCodeException httpError) {
        int status = httpError.getStatusCode().value();
        int code = 0;
        String msg = httpError.getStatusText();
        try {
            JsonNode body = objectMapper.readTree(httpError.getResponseBodyAsString());
            if (body != null && body.has("code")) {
                code = body.get("code").asInt();
                msg = body.path("msg").asText(msg);
            }
        } catch (Exception e) {
            log.debug("Unparseable Binance error body for {}: {}", operation, e.getMessage());
        }
        ExchangeErrorType type = classify(status, code);
        return new BinanceApiException(
                type, status, code, String.format("%s rejected (HTTP %d, code %d): %s", operation, status, code, msg));
    }

    static ExchangeErrorType classify(int httpStatus, int code) {
        if (httpStatus == 429 || httpStatus == 418 || code == -1003) {
            return ExchangeErrorType.RATE_LIMITED;
        }
        if (httpStatus >= 500 || code == -1007 || code == -1021) {
            return ExchangeErrorType.TRANSIENT;
        }
        if (code == -2018 || code == -2019) {
            return ExchangeErrorType.INSUFFICIENT_FUNDS;
        }
        if (httpStatus >= 400) {
            return ExchangeErrorType.INVALID_REQUEST;
        }
        return ExchangeErrorType.UNKNOWN;
    }
}
