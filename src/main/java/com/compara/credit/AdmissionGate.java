package com.compara.credit;

import com.compara.exception.InsufficientCreditsException;
import com.compara.model.Identity;
import com.compara.model.PeriodKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;

/**
 * Service deciding whether a comparison may start, based on the caller's remaining credits.
 */
@Slf4j
@Service
public class AdmissionGate {

    private final CreditLedger ledger;

    public AdmissionGate(CreditLedger ledger) {
        this.ledger = ledger;
    }

    /**
     * Read-only check. Anonymous callers get the minimum of their IP and fingerprint buckets.
     */
    public AdmissionDecision check(Identity identity, int modelCount) {
        List<LedgerEntry> entries = CreditBucket.forIdentity(identity).stream()
                .map(ledger::balance)
                .toList();

        LedgerEntry governing = entries.stream()
                .min(Comparator.comparingLong(LedgerEntry::getRemaining))
                .orElseThrow();

        AdmissionDecision decision = AdmissionDecision.builder()
                .allowed(governing.getRemaining() > 0)
                .remaining(governing.getRemaining())
                .allocated(governing.getAllocated())
                .tier(identity.getTier())
                .periodKind(governing.getPeriodKind())
                .resetAt(governing.getResetAt())
                .build();

        log.debug("Admission check for {} ({} models): remaining={}/{}",
                describe(identity), modelCount, decision.getRemaining(), decision.getAllocated());
        return decision;
    }

    /**
     * Like {@link #check} but rejects the whole comparison when no credits are left.
     *
     * @throws InsufficientCreditsException if remaining credits are 0
     */
    public AdmissionDecision admit(Identity identity, int modelCount) {
        AdmissionDecision decision = check(identity, modelCount);
        if (!decision.isAllowed()) {
            log.info("Rejected comparison for {}: out of credits", describe(identity));
            throw new InsufficientCreditsException(denialMessage(identity, decision), decision.getAllocated());
        }
        return decision;
    }

    String denialMessage(Identity identity, AdmissionDecision decision) {
        if (decision.getPeriodKind() == PeriodKind.DAILY) {
            return "You've run out of credits. Credits will reset to " + decision.getAllocated()
                    + " tomorrow, or sign-up for a free account to get more credits!";
        }
        ZoneId zone = identity.getZone() != null ? identity.getZone() : ZoneId.of("UTC");
        String resetDate = decision.getResetAt() != null
                ? DateTimeFormatter.ISO_LOCAL_DATE.format(decision.getResetAt().atZone(zone))
                : "N/A";
        return "You've run out of credits which will reset on " + resetDate + ".";
    }

    private static String describe(Identity identity) {
        return identity.isAnonymous() ? "anonymous " + identity.getClientIp() : "user " + identity.getUserId();
    }
}
