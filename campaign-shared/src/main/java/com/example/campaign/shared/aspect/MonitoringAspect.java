package com.example.campaign.shared.aspect;

import com.example.campaign.shared.config.MonitoringConfig;
import com.example.campaign.shared.dto.CorrelatedRequest;
import io.opentelemetry.api.trace.Span;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

/**
 * Times every call on a {@link Monitored} bean or method and counts its outcome.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.CampaignMetricsCollector metricsCollector;

    @Around("@within(com.example.campaign.shared.aspect.Monitored) || @annotation(com.example.campaign.shared.aspect.Monitored)")
    public Object monitorMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        // Method-level annotation wins over the class-level one.
        Monitored monitoredAnnotation = method.getAnnotation(Monitored.class);
        if (monitoredAnnotation == null) {
            monitoredAnnotation = method.getDeclaringClass().getAnnotation(Monitored.class);
        }
        if (monitoredAnnotation == null) {
            return joinPoint.proceed();
        }

        String operationType = monitoredAnnotation.value();
        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = signature.getName();
        long startTime = System.currentTimeMillis();

        Span currentSpan = Span.current();
        if (currentSpan.getSpanContext().isValid()) {
            for (Object arg : joinPoint.getArgs()) {
                if (arg instanceof CorrelatedRequest request && request.getCorrelationId() != null) {
                    currentSpan.setAttribute("app.correlation_id", request.getCorrelationId());
                    break;
                }
            }
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            metricsCollector.recordTimer("campaign." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "success");
            metricsCollector.incrementCounter("campaign." + operationType + ".calls", "class", className, "method", methodName, "status", "success");

            log.debug("{}.{} ({}) completed in {}ms", className, methodName, operationType, duration);
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;

            metricsCollector.recordTimer("campaign." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("campaign." + operationType + ".calls", "class", className, "method", methodName, "status", "error");

            if (currentSpan.getSpanContext().isValid()) {
                currentSpan.recordException(e);
            }

            log.debug("{}.{} ({}) failed after {}ms: {}", className, methodName, operationType, duration, e.getMessage());
            throw e;
        }
    }
}
