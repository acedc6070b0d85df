package com.ehrgateway.service;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * PHI access audit trail.
 *
 * Only the resource type, the resource id and the caller's network identity
 * are written; resource contents never are.
 */
@Service
@Slf4j
public class AuditService {

    public enum AuditAction {
        VIEW_PHI,
        SEARCH_PHI,
        CREATE_PHI
    }

    public void log(AuditAction action, String resourceType, String resourceId) {
        String ipAddress = null;
        String userAgent = null;

        ServletRequestAttributes attrs =
            (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs != null) {
            HttpServletRequest request = attrs.getRequest();
            ipAddress = getClientIpAddress(request);
            userAgent = request.getHeader("User-Agent");
        }

        log.info("AUDIT action={} resource={}/{} ip={} userAgent={}",
            action, resourceType, resourceId != null ? resourceId : "-", ipAddress, userAgent);
    }

    public void logPHIAccess(String resourceType, String resourceId) {
        log(AuditAction.VIEW_PHI, resourceType, resourceId);
    }

    private String getClientIpAddress(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
