package me.go_gradually.voicelive.infrastructure.shared.config;

import me.go_gradually.voicelive.application.conversation.policy.ConversationPolicy;
import me.go_gradually.voicelive.application.live.policy.UpstreamPolicy;
import me.go_gradually.voicelive.application.pipeline.policy.PipelinePolicy;
import me.go_gradually.voicelive.application.session.policy.LifecyclePolicy;
import me.go_gradually.voicelive.application.shared.error.ErrorDisclosurePolicy;
import me.go_gradually.voicelive.application.shared.policy.DataDirProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "voicelive")
public class AppProperties implements DataDirProvider, UpstreamPolicy, PipelinePolicy, LifecyclePolicy, ConversationPolicy,
        ErrorDisclosurePolicy {
    private String dataDir = "data";
    private Upstream upstream = new Upstream();
    private Pipeline pipeline = new Pipeline();
    private Lifecycle lifecycle = new Lifecycle();
    private Conversation conversation = new Conversation();
    private Fallback fallback = new Fallback();
    private Errors errors = new Errors();
    private Integrations integrations = new Integrations();

    @Override
    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public Upstream getUpstream() {
        return upstream;
    }

    public void setUpstream(Upstream upstream) {
        this.upstream = upstream;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Lifecycle getLifecycle() {
        return lifecycle;
    }

    public void setLifecycle(Lifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    public Conversation getConversation() {
        return conversation;
    }

    public void setConversation(Conversation conversation) {
        this.conversation = conversation;
    }

    public Fallback getFallback() {
        return fallback;
    }

    public void setFallback(Fallback fallback) {
        this.fallback = fallback;
    }

    public Errors getErrors() {
        return errors;
    }

    public void setErrors(Errors errors) {
        this.errors = errors;
    }

    public Integrations getIntegrations() {
        return integrations;
    }

    public void setIntegrations(Integrations integrations) {
        this.integrations = integrations;
    }

    @Override
    public long upstreamConnectTimeoutMs() {
        return upstream.getConnectTimeoutMs();
    }

    @Override
    public long upstreamSetupTimeoutMs() {
        return upstream.getSetupTimeoutMs();
    }

    @Override
    public long upstreamPrimingSettleMs() {
        return upstream.getPrimingSettleMs();
    }

    @Override
    public String upstreamVoiceName() {
        return upstream.getVoiceName();
    }

    @Override
    public double upstreamTemperature() {
        return upstream.getTemperature();
    }

    @Override
    public int upstreamMaxOutputTokens() {
        return upstream.getMaxOutputTokens();
    }

    @Override
    public double upstreamVadSilenceSeconds() {
        return upstream.getVadSilenceSeconds();
    }

    @Override
    public long bufferDurationMs() {
        return pipeline.getBufferDurationMs();
    }

    @Override
    public int bufferMaxBytes() {
        return pipeline.getBufferMaxBytes();
    }

    @Override
    public int sampleRate() {
        return pipeline.getSampleRate();
    }

    @Override
    public int maxPendingFlushes() {
        return pipeline.getMaxPendingFlushes();
    }

    @Override
    public boolean nativeModeByDefault() {
        return pipeline.isNativeMode();
    }

    @Override
    public long durationWarningSeconds() {
        return lifecycle.getDurationWarningSeconds();
    }

    @Override
    public long warningTimeoutSeconds() {
        return lifecycle.getWarningTimeoutSeconds();
    }

    @Override
    public long inactivityTimeoutSeconds() {
        return lifecycle.getInactivityTimeoutSeconds();
    }

    @Override
    public long checkIntervalSeconds() {
        return lifecycle.getCheckIntervalSeconds();
    }

    @Override
    public long closeGraceMs() {
        return lifecycle.getCloseGraceMs();
    }

    @Override
    public int interruptionStackCapacity() {
        return conversation.getInterruptionStackCapacity();
    }

    @Override
    public long adaptiveWindowSeconds() {
        return conversation.getAdaptiveWindowSeconds();
    }

    @Override
    public int adaptiveSampleCap() {
        return conversation.getAdaptiveSampleCap();
    }

    @Override
    public long directiveTtlSeconds() {
        return conversation.getDirectiveTtlSeconds();
    }

    @Override
    public int historyMessages() {
        return conversation.getHistoryMessages();
    }

    @Override
    public boolean productionErrors() {
        return errors.isProduction();
    }

    public static class Upstream {
        private long connectTimeoutMs = 10000;
        private long setupTimeoutMs = 15000;
        private long primingSettleMs = 1500;
        private String baseUrl;
        private String projectId;
        private String location = "us-central1";
        private String model = "gemini-2.0-flash-live-preview-04-09";
        private String accessToken;
        private String voiceName = "Kore";
        private double temperature = 0.7;
        private int maxOutputTokens = 2048;
        private double vadSilenceSeconds = 0.6;

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public long getSetupTimeoutMs() {
            return setupTimeoutMs;
        }

        public void setSetupTimeoutMs(long setupTimeoutMs) {
            this.setupTimeoutMs = setupTimeoutMs;
        }

        public long getPrimingSettleMs() {
            return primingSettleMs;
        }

        public void setPrimingSettleMs(long primingSettleMs) {
            this.primingSettleMs = primingSettleMs;
        }

        /**
         * Overrides the regional endpoint derived from {@link #getLocation()}.
         */
        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getAccessToken() {
            return accessToken;
        }

        public void setAccessToken(String accessToken) {
            this.accessToken = accessToken;
        }

        public String getVoiceName() {
            return voiceName;
        }

        public void setVoiceName(String voiceName) {
            this.voiceName = voiceName;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxOutputTokens() {
            return maxOutputTokens;
        }

        public void setMaxOutputTokens(int maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
        }

        public double getVadSilenceSeconds() {
            return vadSilenceSeconds;
        }

        public void setVadSilenceSeconds(double vadSilenceSeconds) {
            this.vadSilenceSeconds = vadSilenceSeconds;
        }
    }

    public static class Pipeline {
        private long bufferDurationMs = 2000;
        private int bufferMaxBytes = 102400;
        private int sampleRate = 16000;
        private int maxFrameBytes = 65536;
        private int maxPendingFlushes = 3;
        private boolean nativeMode = true;

        public long getBufferDurationMs() {
            return bufferDurationMs;
        }

        public void setBufferDurationMs(long bufferDurationMs) {
            this.bufferDurationMs = bufferDurationMs;
        }

        public int getBufferMaxBytes() {
            return bufferMaxBytes;
        }

        public void setBufferMaxBytes(int bufferMaxBytes) {
            this.bufferMaxBytes = bufferMaxBytes;
        }

        public int getSampleRate() {
            return sampleRate;
        }

        public void setSampleRate(int sampleRate) {
            this.sampleRate = sampleRate;
        }

        public int getMaxFrameBytes() {
            return maxFrameBytes;
        }

        public void setMaxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
        }

        public int getMaxPendingFlushes() {
            return maxPendingFlushes;
        }

        public void setMaxPendingFlushes(int maxPendingFlushes) {
            this.maxPendingFlushes = maxPendingFlushes;
        }

        public boolean isNativeMode() {
            return nativeMode;
        }

        public void setNativeMode(boolean nativeMode) {
            this.nativeMode = nativeMode;
        }
    }

    public static class Lifecycle {
        private long durationWarningSeconds = 120;
        private long warningTimeoutSeconds = 60;
        private long inactivityTimeoutSeconds = 60;
        private long checkIntervalSeconds = 15;
        private long closeGraceMs = 2000;

        public long getDurationWarningSeconds() {
            return durationWarningSeconds;
        }

        public void setDurationWarningSeconds(long durationWarningSeconds) {
            this.durationWarningSeconds = durationWarningSeconds;
        }

        public long getWarningTimeoutSeconds() {
            return warningTimeoutSeconds;
        }

        public void setWarningTimeoutSeconds(long warningTimeoutSeconds) {
            this.warningTimeoutSeconds = warningTimeoutSeconds;
        }

        public long getInactivityTimeoutSeconds() {
            return inactivityTimeoutSeconds;
        }

        public void setInactivityTimeoutSeconds(long inactivityTimeoutSeconds) {
            this.inactivityTimeoutSeconds = inactivityTimeoutSeconds;
        }

        public long getCheckIntervalSeconds() {
            return checkIntervalSeconds;
        }

        public void setCheckIntervalSeconds(long checkIntervalSeconds) {
            this.checkIntervalSeconds = checkIntervalSeconds;
        }

        public long getCloseGraceMs() {
            return closeGraceMs;
        }

        public void setCloseGraceMs(long closeGraceMs) {
            this.closeGraceMs = closeGraceMs;
        }
    }

    public static class Conversation {
        private int interruptionStackCapacity = 3;
        private long adaptiveWindowSeconds = 300;
        private int adaptiveSampleCap = 10;
        private long directiveTtlSeconds = 300;
        private int historyMessages = 10;

        public int getInterruptionStackCapacity() {
            return interruptionStackCapacity;
        }

        public void setInterruptionStackCapacity(int interruptionStackCapacity) {
            this.interruptionStackCapacity = interruptionStackCapacity;
        }

        public long getAdaptiveWindowSeconds() {
            return adaptiveWindowSeconds;
        }

        public void setAdaptiveWindowSeconds(long adaptiveWindowSeconds) {
            this.adaptiveWindowSeconds = adaptiveWindowSeconds;
        }

        public int getAdaptiveSampleCap() {
            return adaptiveSampleCap;
        }

        public void setAdaptiveSampleCap(int adaptiveSampleCap) {
            this.adaptiveSampleCap = adaptiveSampleCap;
        }

        public long getDirectiveTtlSeconds() {
            return directiveTtlSeconds;
        }

        public void setDirectiveTtlSeconds(long directiveTtlSeconds) {
            this.directiveTtlSeconds = directiveTtlSeconds;
        }

        public int getHistoryMessages() {
            return historyMessages;
        }

        public void setHistoryMessages(int historyMessages) {
            this.historyMessages = historyMessages;
        }
    }

    public static class Fallback {
        private String libraryDir = "fallback-audio";

        public String getLibraryDir() {
            return libraryDir;
        }

        public void setLibraryDir(String libraryDir) {
            this.libraryDir = libraryDir;
        }
    }

    public static class Errors {
        private boolean production = true;

        public boolean isProduction() {
            return production;
        }

        public void setProduction(boolean production) {
            this.production = production;
        }
    }

    public static class Integrations {
        private Http http = new Http();
        private OpenAi openai = new OpenAi();
        private Gemini gemini = new Gemini();

        public Http getHttp() {
            return http;
        }

        public void setHttp(Http http) {
            this.http = http;
        }

        public OpenAi getOpenai() {
            return openai;
        }

        public void setOpenai(OpenAi openai) {
            this.openai = openai;
        }

        public Gemini getGemini() {
            return gemini;
        }

        public void setGemini(Gemini gemini) {
            this.gemini = gemini;
        }
    }

    /**
     * Shared by every HTTP gateway. One pipeline turn waits on STT, LLM and TTS in sequence.
     */
    public static class Http {
        private int maxConnections = 50;
        private long pendingAcquireTimeoutMs = 30000;
        private long responseTimeoutMs = 30000;
        private int maxInMemoryBytes = 20 * 1024 * 1024;

        public int getMaxConnections() {
            return maxConnections;
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
        }

        public long getPendingAcquireTimeoutMs() {
            return pendingAcquireTimeoutMs;
        }

        public void setPendingAcquireTimeoutMs(long pendingAcquireTimeoutMs) {
            this.pendingAcquireTimeoutMs = pendingAcquireTimeoutMs;
        }

        public long getResponseTimeoutMs() {
            return responseTimeoutMs;
        }

        public void setResponseTimeoutMs(long responseTimeoutMs) {
            this.responseTimeoutMs = responseTimeoutMs;
        }

        public int getMaxInMemoryBytes() {
            return maxInMemoryBytes;
        }

        public void setMaxInMemoryBytes(int maxInMemoryBytes) {
            this.maxInMemoryBytes = maxInMemoryBytes;
        }
    }

    public static class OpenAi {
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        private String sttModel = "whisper-1";
        private String ttsModel = "gpt-4o-mini-tts";
        private String ttsVoice = "alloy";

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
    }

    public static class Gemini {
        private String baseUrl = "https://generativelanguage.googleapis.com";
        private String apiKey;
        private String model = "gemini-2.0-flash";

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

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }
}
