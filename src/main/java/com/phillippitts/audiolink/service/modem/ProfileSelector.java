package com.phillippitts.audiolink.service.modem;

import com.phillippitts.audiolink.config.properties.ModemProperties;
import com.phillippitts.audiolink.domain.Payload;
import com.phillippitts.audiolink.domain.TransmissionProfile;
import com.phillippitts.audiolink.exception.InvalidRequestException;
import com.phillippitts.audiolink.exception.PayloadTooLargeException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Chooses the transmission profile for a payload.
 *
 * <p>An explicitly requested profile is used as-is. Otherwise selection starts at the
 * configured default and steps to faster profiles of the same band until the payload fits.
 * Either way the payload must fit the effective ceiling
 * ({@code min(audiolink.modem.max-payload-bytes, profile ceiling)}).
 */
@Component
public class ProfileSelector {

    private final ModemProperties properties;

    public ProfileSelector(ModemProperties properties) {
        this.properties = properties;
    }

    /**
     * @param payload          message to send
     * @param requestedProfile profile name from the request, or null/blank for auto-selection
     * @throws InvalidRequestException  if the requested profile name is unknown
     * @throws PayloadTooLargeException if the payload fits no eligible profile
     */
    public TransmissionProfile select(Payload payload, String requestedProfile) {
        if (requestedProfile != null && !requestedProfile.isBlank()) {
            TransmissionProfile profile = TransmissionProfile.fromName(requestedProfile)
                    .orElseThrow(() -> new InvalidRequestException("Unknown transmission profile '"
                            + requestedProfile.strip() + "'. Supported: " + supportedNames()));
            int ceiling = effectiveCeiling(profile);
            if (payload.length() > ceiling) {
                throw new PayloadTooLargeException(payload.length(), ceiling);
            }
            return profile;
        }

        TransmissionProfile candidate = properties.getDefaultProfile();
        int largestCeiling = 0;
        while (candidate != null) {
            int ceiling = effectiveCeiling(candidate);
            if (payload.length() <= ceiling) {
                return candidate;
            }
            largestCeiling = Math.max(largestCeiling, ceiling);
            Optional<TransmissionProfile> faster = candidate.fasterSibling();
            candidate = faster.orElse(null);
        }
        throw new PayloadTooLargeException(payload.length(), largestCeiling);
    }

    /**
     * Largest payload the given profile accepts under the current configuration.
     */
    public int effectiveCeiling(TransmissionProfile profile) {
        return Math.min(properties.getMaxPayloadBytes(), profile.maxPayloadBytes());
    }

    private static String supportedNames() {
        return Arrays.stream(TransmissionProfile.values())
                .map(TransmissionProfile::name)
                .collect(Collectors.joining(", "));
    }
}
