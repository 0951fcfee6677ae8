package com.vigil.agent.infrastructure.web;

import com.vigil.agent.config.AgentProperties;
import com.vigil.agent.infrastructure.peer.HttpPeerStatusClient;
import com.vigil.observability.CycleContext;
import com.vigil.observability.CycleContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Installs a {@link CycleContext} for every HTTP request.
 * <p>
 * A status request sent by a peer carries the peer's cycle ID in
 * {@value HttpPeerStatusClient#CYCLE_ID_HEADER}, so the log lines of both agents share it. Other
 * requests get a fresh ID. The ID is echoed in the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CycleContextFilter extends OncePerRequestFilter {

    private final String nodeName;

    public CycleContextFilter(AgentProperties properties) {
        this.nodeName = properties.name();
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String cycleId = request.getHeader(HttpPeerStatusClient.CYCLE_ID_HEADER);
        CycleContext context = cycleId == null || cycleId.isBlank()
                ? CycleContext.newCycle(nodeName)
                : new CycleContext(cycleId, nodeName);
        CycleContextHolder.set(context);
        response.setHeader(HttpPeerStatusClient.CYCLE_ID_HEADER, context.cycleId());

        try {
            filterChain.doFilter(request, response);
        } finally {
            CycleContextHolder.clear();
        }
    }
}
