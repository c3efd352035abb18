package quest.gekko.bidopt.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.exception.ValidationException;
import quest.gekko.bidopt.service.core.AccountService;
import quest.gekko.bidopt.web.dto.SelectedAccountsRequest;
import quest.gekko.bidopt.web.dto.SettingsAccounts;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;

    @GetMapping("/ad-accounts")
    public Map<String, Object> accounts(PlatformSession session,
                                        @RequestParam(required = false) String includeOptimization,
                                        @RequestParam(required = false) String recentlyOptimized) {
        List<String> exclusions = recentlyOptimized == null ? List.of()
                : Arrays.stream(recentlyOptimized.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList();
        boolean withFlag = "1".equals(includeOptimization) || "true".equalsIgnoreCase(includeOptimization);
        return Map.of("accounts", accountService.listAccounts(session, withFlag, exclusions));
    }

    @GetMapping("/settings/selected-accounts")
    public Map<String, Object> selectedAccounts(PlatformSession session) {
        // null selectedIds means no selection was ever saved
        return Collections.singletonMap("selectedIds", accountService.getSelectedAccounts(session).orElse(null));
    }

    @PutMapping("/settings/selected-accounts")
    public Map<String, Object> saveSelectedAccounts(PlatformSession session, @RequestBody SelectedAccountsRequest body) {
        if (!(body.selectedIds() instanceof List<?> ids)) {
            throw new ValidationException("selectedIds must be an array");
        }
        return Map.of("selectedIds", accountService.setSelectedAccounts(session, ids));
    }

    @GetMapping("/settings/accounts")
    public SettingsAccounts settingsAccounts(PlatformSession session) {
        return accountService.listSettingsAccounts(session);
    }

    @DeleteMapping("/account")
    public Map<String, Object> deleteAccount(PlatformSession session) {
        accountService.deleteTenantData(session);
        return Map.of("success", true);
    }
}
