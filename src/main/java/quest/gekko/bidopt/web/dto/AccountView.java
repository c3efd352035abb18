package quest.gekko.bidopt.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import quest.gekko.bidopt.domain.AdAccount;

/** An ad account as listed to the caller; {@code hasOptimization} is only set when it was asked for. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountView(
        String id,
        String name,
        String currency,
        String status,
        String type,
        Boolean hasOptimization
) {

    public static AccountView of(AdAccount account) {
        return new AccountView(account.id(), account.name(), account.currency(), account.status(), account.type(), null);
    }

    public AccountView withOptimization(boolean hasOptimization) {
        return new AccountView(id, name, currency, status, type, hasOptimization);
    }
}
