package com.agentgate.core.security;

import com.agentgate.core.error.ErrorResponse;
import com.agentgate.core.logging.MdcContext;
import com.agentgate.core.tenant.TenantConfig;
import com.agentgate.core.tenant.TenantStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bearer-token authentication for {@code /v1/**}.
 *
 * <p>Tenant tokens have the form {@code ocs_<tenantId>_<secret>} and must appear verbatim
 * in the tenant's token list. On success the tenant record is stored under
 * {@link #TENANT_ATTRIBUTE}. {@code /v1/admin/**} instead requires one of the configured
 * admin tokens. Rejections are written as OpenAI {@code authentication_error} envelopes.
 *
 * <p>With auth disabled, tenant tokens are still parsed to find the tenant but the secret
 * is not checked, and admin paths are open.
 */
@Component
@Order(1)
public class TenantAuthFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(TenantAuthFilter.class);

    public static final String TENANT_ATTRIBUTE = "agentgate.tenant";

    private static final Pattern TENANT_TOKEN = Pattern.compile("^Bearer ocs_([^_]+)_(.+)$");
    private static final Pattern BEARER = Pattern.compile("^Bearer (.+)$");

    private static final String PROTECTED_PREFIX = "/v1/";
    private static final String ADMIN_PREFIX = "/v1/admin/";

    private final TenantStore tenantStore;
    private final AuthProperties authProperties;
    private final ObjectMapper objectMapper;

    public TenantAuthFilter(TenantStore tenantStore, AuthProperties authProperties, ObjectMapper objectMapper) {
        this.tenantStore = tenantStore;
        this.authProperties = authProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String path = httpRequest.getRequestURI().substring(httpRequest.getContextPath().length());
        if (!path.startsWith(PROTECTED_PREFIX)) {
            chain.doFilter(request, response);
            return;
        }

        String authHeader = httpRequest.getHeader("Authorization");

        if (path.startsWith(ADMIN_PREFIX)) {
            String rejection = checkAdmin(authHeader);
            if (rejection != null) {
                reject(httpResponse, rejection);
                return;
            }
            chain.doFilter(request, response);
            return;
        }

        Matcher matcher = authHeader == null ? null : TENANT_TOKEN.matcher(authHeader);
        if (matcher == null || !matcher.matches()) {
            reject(httpResponse, "Invalid or missing token");
            return;
        }

        String tenantId = matcher.group(1);
        Optional<TenantConfig> tenant = tenantStore.findTenant(tenantId);
        if (tenant.isEmpty()) {
            reject(httpResponse, "Tenant not found");
            return;
        }
        String token = "ocs_" + tenantId + "_" + matcher.group(2);
        if (authProperties.isEnabled() && !tenant.get().tokens().contains(token)) {
            log.debug("Rejected token for tenant {}", tenantId);
            reject(httpResponse, "Invalid token");
            return;
        }

        request.setAttribute(TENANT_ATTRIBUTE, tenant.get());
        MdcContext.setTenant(tenantId);
        try {
            chain.doFilter(request, response);
        } finally {
            MdcContext.clear();
        }
    }

    /** @return the rejection message, or null when the request may proceed */
    private String checkAdmin(String authHeader) {
        if (!authProperties.isEnabled()) {
            return null;
        }
        Matcher matcher = authHeader == null ? null : BEARER.matcher(authHeader);
        if (matcher == null || !matcher.matches()) {
            return "Invalid or missing admin token";
        }
        if (authProperties.getAdminTokens().isEmpty()) {
            return "No admin tokens configured";
        }
        if (!authProperties.getAdminTokens().contains(matcher.group(1))) {
            return "Invalid or missing admin token";
        }
        return null;
    }

    private void reject(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(),
                ErrorResponse.of(message, "authentication_error", null, null));
    }
}
