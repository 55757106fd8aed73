package com.securepad.portal.submission;

import com.securepad.portal.submission.SubmissionModels.ChallengeStatus;

/**
 * Outcome markers admins may embed in a challenge response, e.g.
 * {@code "[Status: ACCEPTED] Question 3 was ambiguous"}.
 */
public final class ChallengeResponseTags {
    public static final String ACCEPTED = "[Status: ACCEPTED]";
    public static final String REJECTED = "[Status: REJECTED]";
    public static final String REVIEWING = "[Status: REVIEWING]";

    private ChallengeResponseTags() {}

    /** First recognised tag wins in the order accepted, rejected, reviewing; no tag means REVIEWING. */
    public static ChallengeStatus outcomeOf(String response) {
        if (response == null) return ChallengeStatus.REVIEWING;
        if (response.contains(ACCEPTED)) return ChallengeStatus.ACCEPTED;
        if (response.contains(REJECTED)) return ChallengeStatus.REJECTED;
        return ChallengeStatus.REVIEWING;
    }
}
