package hbnb.listing.interceptor;

import hbnb.listing.config.ListingProperties;
import hbnb.listing.service.ListingFacade;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Resolves the caller identity from the identity header.
 * The header is set by the upstream gateway once it has verified the caller;
 * this interceptor only maps it to a live user and its administrator flag.
 * Missing headers and unknown ids resolve to an anonymous caller.
 */
@Component
@Slf4j
public class CallerIdentityInterceptor implements HandlerInterceptor {

    @Autowired
    private ListingFacade listingFacade;

    @Autowired
    private ListingProperties properties;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(CallerIdentity.REQUEST_ATTRIBUTE, resolve(request));
        return true;
    }

    private CallerIdentity resolve(HttpServletRequest request) {
        String userIdHeader = request.getHeader(properties.getIdentityHeader());
        if (userIdHeader == null || userIdHeader.isBlank()) {
            return CallerIdentity.anonymous();
        }

        return listingFacade.findUser(userIdHeader.trim())
                .map(user -> CallerIdentity.of(user.getId(), user.isAdministrator()))
                .orElseGet(() -> {
                    log.warn("Unknown caller id in {} header, treating as anonymous: uri={}",
                            properties.getIdentityHeader(), request.getRequestURI());
                    return CallerIdentity.anonymous();
                });
    }
}
