/**
 * SettingsController.java
 *
 * 内核设置的读取和更新接口。
 * 单作业超时立即生效，其余工作池参数在下次启动时生效，响应中的 restartRequired 会标明这一点。
 */
package club.ppmc.kernel.controller;

import club.ppmc.kernel.model.KernelSettings;
import club.ppmc.kernel.service.SettingsService;
import java.io.IOException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settings")
@Slf4j
public class SettingsController {

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public ResponseEntity<KernelSettings> getSettings() {
        return ResponseEntity.ok(settingsService.getSettings());
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> updateSettings(@RequestBody KernelSettings newSettings) {
        KernelSettings previous = settingsService.getSettings();
        try {
            settingsService.updateSettings(newSettings);
        } catch (IllegalArgumentException e) {
            log.warn("拒绝无效的设置: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        } catch (IOException e) {
            log.error("保存内核设置失败", e);
            return ResponseEntity.internalServerError().body(Map.of("message", "保存设置失败: " + e.getMessage()));
        }
        boolean restartRequired = newSettings.requiresRestartComparedTo(previous);
        String message = restartRequired ? "设置已保存，工作池参数将在重启后生效。" : "设置已保存并生效。";
        return ResponseEntity.ok(Map.of("message", message, "restartRequired", restartRequired));
    }
}
