package hbnb.listing;

import com.fasterxml.jackson.databind.ObjectMapper;
import hbnb.listing.domain.Place;
import hbnb.listing.domain.User;
import hbnb.listing.service.ListingFacade;
import hbnb.listing.testutil.PlaceTestBuilder;
import hbnb.listing.testutil.UserTestBuilder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Base class for integration tests
 * The store lives for the whole Spring context and has no user or place
 * deletion, so every test creates its own users with unique emails.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class BaseIntegrationTest {

    protected static final String IDENTITY_HEADER = "X-User-Id";

    protected static final String ADMIN_EMAIL = "admin@test.hbnb.io";

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected ListingFacade listingFacade;

    // ============= FIXTURES =============

    /**
     * Id of the administrator seeded at startup
     */
    protected String adminId() {
        return listingFacade.findUserByEmail(ADMIN_EMAIL).orElseThrow().getId();
    }

    protected User createGuest() {
        return listingFacade.createUser(UserTestBuilder.guest().build());
    }

    protected User createHost() {
        return listingFacade.createUser(UserTestBuilder.host().build());
    }

    protected Place createPlace(String ownerId) {
        return listingFacade.createPlace(PlaceTestBuilder.ownedBy(ownerId).build());
    }

    protected String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }
}
