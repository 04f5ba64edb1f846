package com.community.leaderboard.filter;

import com.community.leaderboard.dto.CommonResponse;
import com.community.leaderboard.util.PipelineStatusManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Rejects pipeline writes with 423 (Locked) while a build is running, so definitions and
 * activities never change underneath the aggregate and badge stages.
 */
@Component
@Order(1)
public class PipelineStatusFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(PipelineStatusFilter.class);

    static final String PIPELINE_PATH = "/api/pipeline/";

    private final PipelineStatusManager statusManager;
    private final ObjectMapper objectMapper;

    public PipelineStatusFilter(PipelineStatusManager statusManager, ObjectMapper objectMapper) {
        this.statusManager = statusManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        if (statusManager.isBuildInProgress()
                && "POST".equalsIgnoreCase(httpRequest.getMethod())
                && httpRequest.getRequestURI().startsWith(PIPELINE_PATH)) {
            log.warn("Rejected request: {} {} (pipeline build running)",
                    httpRequest.getMethod(), httpRequest.getRequestURI());

            httpResponse.setStatus(423);
            httpResponse.setContentType(MediaType.APPLICATION_JSON_VALUE);
            httpResponse.setCharacterEncoding(StandardCharsets.UTF_8.name());

            CommonResponse<Void> errorResponse = CommonResponse.error(423, "A pipeline build is running, retry later");
            httpResponse.getWriter().write(objectMapper.writeValueAsString(errorResponse));
            return;
        }

        chain.doFilter(request, response);
    }
}
