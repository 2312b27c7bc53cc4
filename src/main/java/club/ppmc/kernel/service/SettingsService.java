/**
 * SettingsService.java
 *
 * 内核服务的配置中心，负责 KernelSettings 的加载、更新和持久化。
 * 配置以JSON格式存储在工作区的隐藏目录 (.kernel) 中。
 * 首次启动时使用 application.properties 中 kernel.* 的值作为默认设置来创建配置文件。
 * 保存成功后发布 KernelSettingsChangedEvent，由监听者把可热更新的项应用到运行中的组件。
 */
package club.ppmc.kernel.service;

import club.ppmc.kernel.event.KernelSettingsChangedEvent;
import club.ppmc.kernel.model.KernelSettings;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);
    static final String SETTINGS_DIR = ".kernel";
    static final String SETTINGS_FILE_NAME = "settings.json";

    private final Path settingsFilePath;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private volatile KernelSettings currentSettings;

    // --- 用于首次初始化的默认值 ---
    private final String initialWorkspaceRoot;
    private final int initialPoolSize;
    private final int initialMemoryMb;
    private final long initialPerJobTimeoutMs;
    private final long initialMaxOutputBytes;
    private final long initialBatchMs;
    private final long initialCancelGraceMs;
    private final long initialWatchdogSlackMs;
    private final String initialNpmCommand;

    public SettingsService(
            @Value("${kernel.workspace-root}") String initialWorkspaceRoot,
            @Value("${kernel.pool.size:0}") int initialPoolSize,
            @Value("${kernel.pool.memory-mb:256}") int initialMemoryMb,
            @Value("${kernel.pool.per-job-timeout-ms:10000}") long initialPerJobTimeoutMs,
            @Value("${kernel.pool.max-output-bytes:5000000}") long initialMaxOutputBytes,
            @Value("${kernel.pool.batch-ms:25}") long initialBatchMs,
            @Value("${kernel.pool.cancel-grace-ms:250}") long initialCancelGraceMs,
            @Value("${kernel.pool.watchdog-slack-ms:5000}") long initialWatchdogSlackMs,
            @Value("${kernel.npm-command:npm}") String initialNpmCommand,
            ApplicationEventPublisher eventPublisher) {

        this.initialWorkspaceRoot = initialWorkspaceRoot;
        this.initialPoolSize = initialPoolSize;
        this.initialMemoryMb = initialMemoryMb;
        this.initialPerJobTimeoutMs = initialPerJobTimeoutMs;
        this.initialMaxOutputBytes = initialMaxOutputBytes;
        this.initialBatchMs = initialBatchMs;
        this.initialCancelGraceMs = initialCancelGraceMs;
        this.initialWatchdogSlackMs = initialWatchdogSlackMs;
        this.initialNpmCommand = initialNpmCommand;
        this.eventPublisher = eventPublisher;

        this.settingsFilePath =
                Paths.get(initialWorkspaceRoot, SETTINGS_DIR, SETTINGS_FILE_NAME)
                        .toAbsolutePath()
                        .normalize();
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @PostConstruct
    public void init() {
        try {
            Path settingsDir = this.settingsFilePath.getParent();
            if (Files.notExists(settingsDir)) {
                Files.createDirectories(settingsDir);
            }
            if (Files.exists(this.settingsFilePath)) {
                loadSettings();
            } else {
                createAndSaveDefaultSettings();
            }
        } catch (IOException e) {
            LOGGER.error("初始化设置失败。将使用临时的默认设置。", e);
            this.currentSettings = createDefaultSettings();
        }
    }

    public synchronized KernelSettings getSettings() {
        return this.currentSettings;
    }

    Path getSettingsFilePath() {
        return settingsFilePath;
    }

    /**
     * 保存新设置并发布 KernelSettingsChangedEvent。
     * 工作区根目录不允许在运行时修改，请求中的值会被忽略。
     *
     * @throws IllegalArgumentException 数值项不合法时。
     * @throws IOException 写入设置文件失败时，此时内存中的设置保持不变。
     */
    public synchronized void updateSettings(KernelSettings newSettings) throws IOException {
        validate(newSettings);
        KernelSettings previous = this.currentSettings;
        newSettings.setWorkspaceRoot(previous.getWorkspaceRoot());
        saveSettings(newSettings);
        this.currentSettings = newSettings;
        eventPublisher.publishEvent(new KernelSettingsChangedEvent(previous, newSettings));
    }

    private static void validate(KernelSettings settings) {
        if (settings.getPoolSize() < 0) {
            throw new IllegalArgumentException("poolSize 不能为负数");
        }
        if (settings.getMemoryMb() < 16) {
            throw new IllegalArgumentException("memoryMb 至少为 16");
        }
        if (settings.getPerJobTimeoutMs() <= 0 || settings.getPerJobTimeoutMs() > 600_000) {
            throw new IllegalArgumentException("perJobTimeoutMs 必须在 1 到 600000 之间");
        }
        if (settings.getMaxOutputBytes() <= 0) {
            throw new IllegalArgumentException("maxOutputBytes 必须为正数");
        }
    }

    private void loadSettings() throws IOException {
        try {
            byte[] jsonData = Files.readAllBytes(settingsFilePath);
            this.currentSettings = objectMapper.readValue(jsonData, KernelSettings.class);
            // 设置文件所在的工作区以启动参数为准
            this.currentSettings.setWorkspaceRoot(initialWorkspaceRoot);
            LOGGER.info("已成功从 {} 加载设置。", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("读取设置文件时出错。下次保存时将创建新的默认文件。", e);
            this.currentSettings = createDefaultSettings();
            throw e;
        }
    }

    private void saveSettings(KernelSettings settings) throws IOException {
        try {
            byte[] jsonData = objectMapper.writeValueAsBytes(settings);
            Files.write(settingsFilePath, jsonData);
            LOGGER.info("已成功将设置保存到 {}", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("将设置保存到文件 {} 时失败", settingsFilePath, e);
            throw e;
        }
    }

    private void createAndSaveDefaultSettings() throws IOException {
        this.currentSettings = createDefaultSettings();
        saveSettings(currentSettings);
        LOGGER.info("未找到设置文件。已在 {} 创建了包含默认值的新文件。", settingsFilePath);
    }

    private KernelSettings createDefaultSettings() {
        var settings = new KernelSettings();
        settings.setWorkspaceRoot(this.initialWorkspaceRoot);
        settings.setPoolSize(Math.max(0, this.initialPoolSize));
        settings.setMemoryMb(this.initialMemoryMb);
        settings.setPerJobTimeoutMs(this.initialPerJobTimeoutMs);
        settings.setMaxOutputBytes(this.initialMaxOutputBytes);
        settings.setBatchMs(this.initialBatchMs);
        settings.setCancelGraceMs(this.initialCancelGraceMs);
        settings.setWatchdogSlackMs(this.initialWatchdogSlackMs);
        if (StringUtils.hasText(this.initialNpmCommand)) {
            settings.setNpmCommand(this.initialNpmCommand);
        }
        return settings;
    }
}
