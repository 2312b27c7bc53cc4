/**
 * KernelSettingsChangedEvent.java
 *
 * 设置保存成功后由 SettingsService 发布的Spring应用事件。
 */
package club.ppmc.kernel.event;

import club.ppmc.kernel.model.KernelSettings;

/**
 * @param previous 修改前的设置。
 * @param current 刚刚保存的设置。
 */
public record KernelSettingsChangedEvent(KernelSettings previous, KernelSettings current) {}
