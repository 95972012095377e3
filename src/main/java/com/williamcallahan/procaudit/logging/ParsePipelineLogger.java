package com.williamcallahan.procaudit.logging;

import com.williamcallahan.procaudit.domain.procedure.ProcedureParseResult;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Logging aspect for the procedure parsing pipeline.
 * Logs each parse with a request id, duration and result counts. The request id is also put
 * in the MDC so service log lines written during the parse carry it.
 */
@Aspect
@Component
public class ParsePipelineLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");
    private static final String REQUEST_ID_KEY = "requestId";
    private static final AtomicLong SEQUENCE = new AtomicLong();

    /**
     * Log document parsing
     */
    @Around("execution(* com.williamcallahan.procaudit.service.ProcedureParsingService.parse*(..))")
    public Object logDocumentParsing(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = "REQ-" + System.currentTimeMillis() + "-" + Thread.currentThread().getId()
            + "-" + SEQUENCE.incrementAndGet();
        MDC.put(REQUEST_ID_KEY, requestId);
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] PROCEDURE PARSING - Starting", requestId);
        Object[] args = joinPoint.getArgs();
        if (args.length > 0) {
            PIPELINE_LOG.debug("[{}] {} {}", requestId, joinPoint.getSignature().getName(), args[0]);
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof ProcedureParseResult) {
                ProcedureParseResult parsed = (ProcedureParseResult) result;
                PIPELINE_LOG.info("[{}] PROCEDURE PARSING - Completed in {}ms: {} procedures, {} warnings",
                    requestId, duration, parsed.procedures().size(), parsed.warnings().size());
            } else {
                PIPELINE_LOG.info("[{}] PROCEDURE PARSING - Completed in {}ms", requestId, duration);
            }

            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] PROCEDURE PARSING - Failed: {}",
                requestId, e.getMessage());
            throw e;
        } finally {
            MDC.remove(REQUEST_ID_KEY);
        }
    }
}
