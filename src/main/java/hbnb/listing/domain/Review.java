package hbnb.listing.domain;

import lombok.Getter;
import lombok.ToString;

/**
 * Review entity written by a user about a place.
 * The author and place references are fixed at construction.
 */
@Getter
@ToString
public class Review extends BaseEntity {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    private String text;

    /**
     * Rating from 1 to 5
     */
    private Integer rating;

    /**
     * Author user id
     */
    private final String userId;

    /**
     * Reviewed place id
     */
    private final String placeId;

    public Review(String text, Integer rating, String userId, String placeId) {
        setText(text);
        setRating(rating);
        this.userId = FieldValidator.requireReference("userId", userId);
        this.placeId = FieldValidator.requireReference("placeId", placeId);
    }

    private Review(Review source) {
        super(source);
        this.text = source.text;
        this.rating = source.rating;
        this.userId = source.userId;
        this.placeId = source.placeId;
    }

    public Review copy() {
        return new Review(this);
    }

    public void setText(String text) {
        this.text = FieldValidator.requireText("text", text);
    }

    public void setRating(Integer rating) {
        this.rating = FieldValidator.requireIntRange("rating", rating, MIN_RATING, MAX_RATING);
    }
}
