package hbnb.listing.controller;

import hbnb.listing.BaseIntegrationTest;
import hbnb.listing.domain.Amenity;
import hbnb.listing.dto.AmenityRequest;
import hbnb.listing.service.command.AmenityCommand;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AmenityControllerTest extends BaseIntegrationTest {

    @Test
    void testAdminCreatesAmenity() throws Exception {
        mockMvc.perform(post("/api/v1/amenities")
                        .header(IDENTITY_HEADER, adminId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new AmenityRequest("Sauna"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.name").value("Sauna"))
                .andExpect(jsonPath("$.data.id").isNotEmpty());
    }

    @Test
    void testNonAdminCannotCreateAmenity() throws Exception {
        String guestId = createGuest().getId();

        mockMvc.perform(post("/api/v1/amenities")
                        .header(IDENTITY_HEADER, guestId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new AmenityRequest("Hot tub"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Admin privileges required"));
        mockMvc.perform(post("/api/v1/amenities")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new AmenityRequest("Hot tub"))))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void testUpdateAndGetAmenity() throws Exception {
        Amenity amenity = listingFacade.createAmenity(AmenityCommand.builder().name("Parking").build());

        mockMvc.perform(put("/api/v1/amenities/{id}", amenity.getId())
                        .header(IDENTITY_HEADER, adminId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new AmenityRequest("Covered parking"))))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/amenities/{id}", amenity.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("Covered parking"));
        mockMvc.perform(get("/api/v1/amenities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray());
    }

    @Test
    void testBlankNameRejected() throws Exception {
        mockMvc.perform(post("/api/v1/amenities")
                        .header(IDENTITY_HEADER, adminId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new AmenityRequest("  "))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION"));
    }
}
