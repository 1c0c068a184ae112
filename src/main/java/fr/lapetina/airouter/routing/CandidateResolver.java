package fr.lapetina.airouter.routing;

import fr.lapetina.airouter.domain.exception.RoutingException;
import fr.lapetina.airouter.domain.model.CanonicalRequest;
import fr.lapetina.airouter.domain.model.HealthStatus;
import fr.lapetina.airouter.infrastructure.config.RouterConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns a requested model into an ordered candidate list.
 *
 * A configured alias maps to its preference list; otherwise {@code provider/model} names
 * exactly one candidate on a known provider.
 */
public final class CandidateResolver {

    private final Map<String, List<Candidate>> aliases;
    private final Set<String> providerIds;

    public CandidateResolver(Map<String, List<Candidate>> aliases, Set<String> providerIds) {
        Map<String, List<Candidate>> copy = new HashMap<>();
        aliases.forEach((name, candidates) -> copy.put(name, List.copyOf(candidates)));
        this.aliases = Map.copyOf(copy);
        this.providerIds = Set.copyOf(providerIds);
    }

    public static CandidateResolver fromConfig(RouterConfig config) {
        Map<String, List<Candidate>> aliases = new HashMap<>();
        for (RouterConfig.ModelConfig model : config.getModels()) {
            aliases.put(model.getName(), model.getCandidates().stream().map(Candidate::parse).toList());
        }
        Set<String> providerIds = new HashSet<>();
        for (RouterConfig.ProviderConfig provider : config.getProviders()) {
            if (provider.isEnabled()) {
                providerIds.add(provider.getId());
            }
        }
        return new CandidateResolver(aliases, providerIds);
    }

    /**
     * @throws RoutingException INVALID_REQUEST for an unknown alias or provider
     */
    public List<Candidate> resolve(CanonicalRequest request) {
        String model = request.model();
        List<Candidate> alias = aliases.get(model);
        if (alias != null) {
            List<Candidate> enabled = alias.stream()
                    .filter(candidate -> providerIds.contains(candidate.providerId()))
                    .toList();
            if (enabled.isEmpty()) {
                throw RoutingException.invalidRequest(request.id(), "No enabled provider for model: " + model);
            }
            return enabled;
        }

        Candidate direct;
        try {
            direct = Candidate.parse(model);
        } catch (IllegalArgumentException e) {
            throw RoutingException.invalidRequest(request.id(), "Unknown model: " + model);
        }
        if (!providerIds.contains(direct.providerId())) {
            throw RoutingException.invalidRequest(request.id(), "Unknown provider: " + direct.providerId());
        }
        return List.of(direct);
    }

    /**
     * Moves unhealthy candidates to the end, keeping relative order on both sides.
     * Nothing is removed: stale health must not empty the list.
     */
    public static List<Candidate> orderByHealth(List<Candidate> candidates, Function<String, HealthStatus> health) {
        List<Candidate> ordered = new ArrayList<>(candidates.size());
        List<Candidate> unhealthy = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (health.apply(candidate.providerId()) == HealthStatus.UNHEALTHY) {
                unhealthy.add(candidate);
            } else {
                ordered.add(candidate);
            }
        }
        ordered.addAll(unhealthy);
        return ordered;
    }

    public Set<String> aliasNames() {
        return aliases.keySet();
    }
}
