package com.numaansystems.headersso.filter;

import com.numaansystems.headersso.config.HeaderAuthProperties;
import com.numaansystems.headersso.model.IdentityAssertion;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.LinkedCaseInsensitiveMap;

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Reads the identity headers set by the proxy into an {@link IdentityAssertion}.
 *
 * <p>Header names are matched case-insensitively. Only the email header or
 * the principal name header is needed to attempt resolution; object id and
 * display name are carried along for provisioning and diagnostics. No I/O is
 * performed and nothing here throws for missing headers.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class TrustedHeaderExtractor {

    private final HeaderAuthProperties.Headers names;

    public TrustedHeaderExtractor(HeaderAuthProperties.Headers names) {
        this.names = names;
    }

    /**
     * Extracts the assertion from the request headers.
     */
    public IdentityAssertion extract(HttpServletRequest request) {
        return extract(request::getHeader);
    }

    /**
     * Extracts the assertion from a plain header map.
     *
     * @param headers header name to value; names in any case
     * @return the assertion, {@link IdentityAssertion#isEmpty()} if no identity was sent
     */
    public IdentityAssertion extract(Map<String, String> headers) {
        Map<String, String> caseInsensitive = new LinkedCaseInsensitiveMap<>(headers.size());
        caseInsensitive.putAll(headers);
        return extract(caseInsensitive::get);
    }

    /**
     * Name of the header that carries the browser id used to bind sessions.
     */
    public String browserIdHeader() {
        return names.browserId();
    }

    private IdentityAssertion extract(UnaryOperator<String> header) {
        IdentityAssertion assertion = new IdentityAssertion(
                header.apply(names.email()),
                header.apply(names.upn()),
                header.apply(names.objectId()),
                header.apply(names.displayName()));
        return assertion.isEmpty() ? IdentityAssertion.empty() : assertion;
    }
}
