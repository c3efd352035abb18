package quest.gekko.bidopt.service.integration.connector;

import quest.gekko.bidopt.domain.Campaign;

import java.util.List;

public record CampaignPage(List<Campaign> elements, String nextPageToken) {

    public boolean hasNext() {
        return nextPageToken != null && !nextPageToken.isBlank() && !elements.isEmpty();
    }
}
