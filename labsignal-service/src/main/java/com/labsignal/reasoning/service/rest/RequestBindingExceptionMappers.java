package com.labsignal.reasoning.service.rest;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.labsignal.reasoning.service.service.InvalidRequestException;
import jakarta.ws.rs.core.Response;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import java.util.List;
import java.util.logging.Logger;

/**
 * Turns request bodies that cannot be bound (unknown intake codes, fractional
 * ages, wrong JSON types) into the same 400 shape as validation failures.
 */
public class RequestBindingExceptionMappers {
    private static final Logger logger = Logger.getLogger(RequestBindingExceptionMappers.class.getName());

    @ServerExceptionMapper
    public Response mapMismatchedInput(MismatchedInputException e) {
        return toBadRequest(e);
    }

    @ServerExceptionMapper
    public Response mapJsonMapping(JsonMappingException e) {
        return toBadRequest(e);
    }

    static Response toBadRequest(JsonMappingException e) {
        String violation = describe(e);
        logger.fine("Rejected request body: " + violation);
        return SignalsResource.badRequest(new InvalidRequestException(List.of(violation)));
    }

    /**
     * Renders e.g. {@code "patient.symptoms[0]: Unknown symptom: headache"}.
     */
    static String describe(JsonMappingException e) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (path.length() > 0) path.append('.');
                path.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                path.append('[').append(ref.getIndex()).append(']');
            }
        }
        // creator failures carry the readable message on the cause
        String reason = e.getCause() instanceof IllegalArgumentException
                ? e.getCause().getMessage()
                : e.getOriginalMessage();
        return path.length() == 0 ? reason : path + ": " + reason;
    }
}
