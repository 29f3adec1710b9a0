package com.remotelink.app.web;

import com.remotelink.common.response.ApiResponse;
import com.remotelink.gateway.dispatch.HttpStatusMapper;
import com.remotelink.gateway.dispatch.Request;
import com.remotelink.gateway.dispatch.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single HTTP entry point: every {@code /api/{name}} call is turned into a
 * {@link Request} and handed to the {@link RequestDispatcher}.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class ApiController {

    static final String TOKEN_HEADER = "X-Auth-Token";

    private final RequestDispatcher dispatcher;

    public ApiController(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @RequestMapping(value = "/{name}", method = { RequestMethod.GET, RequestMethod.POST, RequestMethod.OPTIONS })
    public ResponseEntity<Map<String, Object>> call(
            @PathVariable("name") String name,
            @RequestParam MultiValueMap<String, String> query,
            @RequestBody(required = false) Map<String, Object> body,
            HttpServletRequest httpRequest) {

        Map<String, Object> payload = mergePayload(query, body);
        Request request = new Request(name, httpRequest.getMethod(), payload,
                extractToken(httpRequest, payload), httpRequest.getRemoteAddr());

        ApiResponse response = dispatcher.dispatch(request);
        return toEntity(response);
    }

    static ResponseEntity<Map<String, Object>> toEntity(ApiResponse response) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatusMapper.statusOf(response));
        if (response instanceof ApiResponse.NoContent) {
            return builder.build();
        }
        return builder.body(response.toWire());
    }

    /** Query parameters first; body fields win on conflict. */
    static Map<String, Object> mergePayload(MultiValueMap<String, String> query, Map<String, Object> body) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (query != null) {
            for (Map.Entry<String, List<String>> entry : query.entrySet()) {
                List<String> values = entry.getValue();
                if (values == null || values.isEmpty()) {
                    continue;
                }
                payload.put(entry.getKey(), values.size() == 1 ? values.get(0) : List.copyOf(values));
            }
        }
        if (body != null) {
            payload.putAll(body);
        }
        return payload;
    }

    /** Bearer header, then {@code X-Auth-Token}, then a {@code token} field. */
    static String extractToken(HttpServletRequest request, Map<String, Object> payload) {
        String auth = request.getHeader("Authorization");
        if (auth != null && auth.startsWith("Bearer ")) {
            return auth.substring(7).trim();
        }
        String header = request.getHeader(TOKEN_HEADER);
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        Object field = payload.get("token");
        return field == null ? null : field.toString();
    }
}
