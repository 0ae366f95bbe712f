package kyc.core.service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;

import kyc.core.model.IdentityProfile;

/**
 * Maps provider userinfo claims onto an {@link IdentityProfile}.
 *
 * <p>The provider returns localized claims with a {@code #<locale>} suffix
 * ({@code name#en}, {@code name#am}). Lookup order:
 * <ul>
 *   <li>given name: {@code given_name}, {@code given_name#en}, {@code name#en}, {@code name}</li>
 *   <li>family name: {@code family_name}, {@code family_name#en}</li>
 *   <li>everything else: the plain claim, then its {@code #en} variant</li>
 * </ul>
 *
 * <p>A full {@code name} is never split into given and family parts.
 */
@ApplicationScoped
public class ClaimNormalizer {

    static final String PREFERRED_LOCALE = "en";

    private static final List<String> ADDRESS_PARTS =
            List.of("street_address", "locality", "region", "postal_code", "country");

    public IdentityProfile normalize(String subjectId, Map<String, Object> claims) {
        return new IdentityProfile(
                subjectId,
                firstPresent(claims, "given_name", localized("given_name"), localized("name"), "name"),
                firstPresent(claims, "family_name", localized("family_name")),
                attribute(claims, "email"),
                attribute(claims, "phone_number"),
                attribute(claims, "birthdate"),
                attribute(claims, "gender"),
                attribute(claims, "address"),
                attribute(claims, "picture"),
                claims);
    }

    private static String attribute(Map<String, Object> claims, String name) {
        return firstPresent(claims, name, localized(name));
    }

    private static String localized(String name) {
        return name + "#" + PREFERRED_LOCALE;
    }

    private static String firstPresent(Map<String, Object> claims, String... names) {
        for (String name : names) {
            final var value = render(claims.get(name));
            if (value.isPresent()) {
                return value.get();
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Optional<String> render(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Map<?, ?> map) {
            return renderStructured((Map<String, Object>) map);
        }
        final var text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    // OIDC structured address: prefer "formatted", else join the standard parts
    private static Optional<String> renderStructured(Map<String, Object> map) {
        final var formatted = render(map.get("formatted"));
        if (formatted.isPresent()) {
            return formatted;
        }
        final var joined = ADDRESS_PARTS.stream()
                .map(part -> map.containsKey(part) ? map.get(part) : map.get(localized(part)))
                .filter(Objects::nonNull)
                .map(Object::toString)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(", "));
        return joined.isEmpty() ? Optional.empty() : Optional.of(joined);
    }
}
