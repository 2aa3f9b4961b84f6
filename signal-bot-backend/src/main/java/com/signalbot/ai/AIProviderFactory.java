package com.signalbot.ai;

import com.signalbot.config.BotConfig;
import com.signalbot.config.ProviderSettings;
import com.signalbot.core.ai.AIProvider;
import com.signalbot.core.ai.AIProviderManager;
import com.signalbot.core.resilience.RateLimiter;
import okhttp3.OkHttpClient;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Builds the ordered provider registrations (primary first, then fallbacks) from config.
 * Settings are validated when the manager initializes each provider, so one bad key
 * only disables that provider.
 */
public final class AIProviderFactory {

    private AIProviderFactory() {
    }

    public static List<AIProviderManager.Registration> registrations(BotConfig config, OkHttpClient httpClient,
                                                                     ScheduledExecutorService poller) {
        List<AIServiceType> order = new ArrayList<>();
        order.add(config.getPrimaryAiService());
        order.addAll(config.getFallbackAiServices());

        List<AIProviderManager.Registration> registrations = new ArrayList<>();
        for (AIServiceType service : order) {
            JsonHttpTransport transport = new OkHttpJsonTransport(service.name(), httpClient);
            AIProvider provider = create(service, () -> config.providerSettings(service), transport);
            RateLimiter limiter = RateLimiter.forAiProvider(service.name(),
                config.getAiRequestsPerMinute(service), poller);
            registrations.add(new AIProviderManager.Registration(provider, limiter));
        }
        return registrations;
    }

    public static AIProvider create(AIServiceType service, Supplier<ProviderSettings> settings,
                                    JsonHttpTransport transport) {
        return switch (service) {
            case GEMINI -> new GeminiProvider(settings, transport);
            case CLAUDE -> new ClaudeProvider(settings, transport);
            case OPENAI -> new OpenAIProvider(settings, transport);
        };
    }
}
