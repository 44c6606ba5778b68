package com.jz.crm.controller;

import com.jz.crm.common.ConversationNotFoundException;
import com.jz.crm.common.IllegalTransitionException;
import com.jz.crm.common.MessageDeliveryException;
import com.jz.crm.common.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ConversationNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Result<Void> notFound(ConversationNotFoundException e) {
        return Result.error(404, e.getMessage());
    }

    @ExceptionHandler(IllegalTransitionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Result<Void> conflict(IllegalTransitionException e) {
        log.warn("[Api] {}", e.getMessage());
        return Result.error(409, e.getMessage());
    }

    @ExceptionHandler(MessageDeliveryException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Result<Void> delivery(MessageDeliveryException e) {
        return Result.error(502, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<Void> badRequest(IllegalArgumentException e) {
        return Result.error(400, e.getMessage());
    }
}
