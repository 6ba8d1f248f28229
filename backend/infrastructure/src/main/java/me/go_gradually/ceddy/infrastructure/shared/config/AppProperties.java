package me.go_gradually.ceddy.infrastructure.shared.config;

import me.go_gradually.ceddy.application.interaction.policy.InteractionPolicy;
import me.go_gradually.ceddy.application.room.policy.RoomPolicy;
import me.go_gradually.ceddy.application.shared.policy.RuntimePolicy;
import me.go_gradually.ceddy.application.transcript.policy.TranscriptPolicy;
import me.go_gradually.ceddy.domain.wakeword.WakeWord;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Locale;

@ConfigurationProperties(prefix = "ceddy")
public class AppProperties implements InteractionPolicy, TranscriptPolicy, RoomPolicy, RuntimePolicy {
    private Environment environment = Environment.DEVELOP;
    private Boolean debug;
    private String wakeWord = WakeWord.DEFAULT_PHRASE;
    private Interaction interaction = new Interaction();
    private Transcripts transcripts = new Transcripts();
    private Integrations integrations = new Integrations();

    public Environment getEnvironment() {
        return environment;
    }

    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }

    public Boolean getDebug() {
        return debug;
    }

    public void setDebug(Boolean debug) {
        this.debug = debug;
    }

    public String getWakeWord() {
        return wakeWord;
    }

    public void setWakeWord(String wakeWord) {
        this.wakeWord = wakeWord;
    }

    public Interaction getInteraction() {
        return interaction;
    }

    public void setInteraction(Interaction interaction) {
        this.interaction = interaction;
    }

    public Transcripts getTranscripts() {
        return transcripts;
    }

    public void setTranscripts(Transcripts transcripts) {
        this.transcripts = transcripts;
    }

    public Integrations getIntegrations() {
        return integrations;
    }

    public void setIntegrations(Integrations integrations) {
        this.integrations = integrations;
    }

    @Override
    public String environmentName() {
        return environment.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean debug() {
        if (debug != null) {
            return debug;
        }
        return environment == Environment.DEVELOP || environment == Environment.TEST;
    }

    @Override
    public String wakeWord() {
        return wakeWord;
    }

    @Override
    public boolean serializePerSession() {
        return interaction.isSerializePerSession();
    }

    @Override
    public int transcriptFilterLimit() {
        return transcripts.getFilterLimit();
    }

    @Override
    public boolean roomServiceConfigured() {
        return tokenServiceConfigured() && hasText(integrations.getLivekit().getUrl());
    }

    @Override
    public boolean tokenServiceConfigured() {
        LiveKit livekit = integrations.getLivekit();
        return hasText(livekit.getApiKey()) && hasText(livekit.getApiSecret());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public enum Environment {
        PRODUCTION,
        STAGING,
        DEVELOP,
        TEST
    }

    public static class Interaction {
        private boolean serializePerSession = true;

        public boolean isSerializePerSession() {
            return serializePerSession;
        }

        public void setSerializePerSession(boolean serializePerSession) {
            this.serializePerSession = serializePerSession;
        }
    }

    public static class Transcripts {
        private int filterLimit = 10;

        public int getFilterLimit() {
            return filterLimit;
        }

        public void setFilterLimit(int filterLimit) {
            this.filterLimit = filterLimit;
        }
    }

    public static class Integrations {
        private OpenAi openai = new OpenAi();
        private ElevenLabs elevenlabs = new ElevenLabs();
        private LiveKit livekit = new LiveKit();

        public OpenAi getOpenai() {
            return openai;
        }

        public void setOpenai(OpenAi openai) {
            this.openai = openai;
        }

        public ElevenLabs getElevenlabs() {
            return elevenlabs;
        }

        public void setElevenlabs(ElevenLabs elevenlabs) {
            this.elevenlabs = elevenlabs;
        }

        public LiveKit getLivekit() {
            return livekit;
        }

        public void setLivekit(LiveKit livekit) {
            this.livekit = livekit;
        }
    }

    public static class OpenAi {
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        private String sttModel = "whisper-1";
        private String assistantId;
        private String assistantModel = "gpt-4-turbo-preview";
        private String ttsModel = "tts-1";
        private String ttsVoice = "alloy";
        private long pollInitialIntervalMs = 250;
        private long pollMaxIntervalMs = 2000;
        private double pollMultiplier = 2.0;
        private long pollTimeoutMs = 60000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getSttModel() {
            return sttModel;
        }

        public void setSttModel(String sttModel) {
            this.sttModel = sttModel;
        }

        public String getAssistantId() {
            return assistantId;
        }

        public void setAssistantId(String assistantId) {
            this.assistantId = assistantId;
        }

        public String getAssistantModel() {
            return assistantModel;
        }

        public void setAssistantModel(String assistantModel) {
            this.assistantModel = assistantModel;
        }

        public String getTtsModel() {
            return ttsModel;
        }

        public void setTtsModel(String ttsModel) {
            this.ttsModel = ttsModel;
        }

        public String getTtsVoice() {
            return ttsVoice;
        }

        public void setTtsVoice(String ttsVoice) {
            this.ttsVoice = ttsVoice;
        }

        public long getPollInitialIntervalMs() {
            return pollInitialIntervalMs;
        }

        public void setPollInitialIntervalMs(long pollInitialIntervalMs) {
            this.pollInitialIntervalMs = pollInitialIntervalMs;
        }

        public long getPollMaxIntervalMs() {
            return pollMaxIntervalMs;
        }

        public void setPollMaxIntervalMs(long pollMaxIntervalMs) {
            this.pollMaxIntervalMs = pollMaxIntervalMs;
        }

        public double getPollMultiplier() {
            return pollMultiplier;
        }

        public void setPollMultiplier(double pollMultiplier) {
            this.pollMultiplier = pollMultiplier;
        }

        public long getPollTimeoutMs() {
            return pollTimeoutMs;
        }

        public void setPollTimeoutMs(long pollTimeoutMs) {
            this.pollTimeoutMs = pollTimeoutMs;
        }
    }

    public static class ElevenLabs {
        private String baseUrl = "https://api.elevenlabs.io";
        private String apiKey;
        private String voiceId = "21m00Tcm4TlvDq8ikWAM";
        private String modelId = "eleven_monolingual_v1";
        private double stability = 0.5;
        private double similarityBoost = 0.5;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getVoiceId() {
            return voiceId;
        }

        public void setVoiceId(String voiceId) {
            this.voiceId = voiceId;
        }

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public double getStability() {
            return stability;
        }

        public void setStability(double stability) {
            this.stability = stability;
        }

        public double getSimilarityBoost() {
            return similarityBoost;
        }

        public void setSimilarityBoost(double similarityBoost) {
            this.similarityBoost = similarityBoost;
        }
    }

    public static class LiveKit {
        private String url;
        private String apiKey;
        private String apiSecret;
        private long serverTokenTtlSeconds = 600;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiSecret() {
            return apiSecret;
        }

        public void setApiSecret(String apiSecret) {
            this.apiSecret = apiSecret;
        }

        public long getServerTokenTtlSeconds() {
            return serverTokenTtlSeconds;
        }

        public void setServerTokenTtlSeconds(long serverTokenTtlSeconds) {
            this.serverTokenTtlSeconds = serverTokenTtlSeconds;
        }
    }
}
