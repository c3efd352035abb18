package quest.gekko.bidopt.web.dto;

import quest.gekko.bidopt.domain.AdAccount;

import java.util.List;

/** Every account of the caller plus the current selection; {@code selectedIds} is null when never set. */
public record SettingsAccounts(List<AdAccount> accounts, List<String> selectedIds) {}
