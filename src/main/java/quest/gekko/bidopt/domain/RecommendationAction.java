package quest.gekko.bidopt.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationAction {
    INCREASE,
    DECREASE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
