package hbnb.listing.config;

import hbnb.listing.exception.BusinessException;
import hbnb.listing.service.ListingFacade;
import hbnb.listing.service.command.UserCommand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Startup runner seeding the default administrator.
 *
 * Creates the configured admin account when its email is unused, or promotes
 * the existing account otherwise. Disabled with listing.admin.enabled=false.
 */
@Slf4j
@Component
@Order(1)
public class DefaultAdminInitializer implements ApplicationRunner {

    @Autowired
    private ListingFacade listingFacade;

    @Autowired
    private ListingProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        ListingProperties.Admin admin = properties.getAdmin();
        if (!admin.isEnabled()) {
            log.info("Default administrator seeding disabled");
            return;
        }

        try {
            if (listingFacade.findUserByEmail(admin.getEmail()).isPresent()) {
                listingFacade.promoteToAdministrator(admin.getEmail());
                log.info("Default administrator already present: email={}", admin.getEmail());
                return;
            }

            String userId = listingFacade.createUser(UserCommand.builder()
                    .firstName(admin.getFirstName())
                    .lastName(admin.getLastName())
                    .email(admin.getEmail())
                    .password(admin.getPassword())
                    .administrator(true)
                    .build()).getId();
            log.info("Default administrator created: userId={}, email={}", userId, admin.getEmail());
        } catch (BusinessException e) {
            log.error("Failed to seed default administrator: email={}, error={}",
                    admin.getEmail(), e.getMessage(), e);
            throw e;
        }
    }
}
