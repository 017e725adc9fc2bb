package dev.clubhub.bot.config;

import dev.clubhub.bot.module.music.permission.PermissionLevel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ConfigurationFile {
    public String token = "place your bot token here";
    public String targetGuildId = "0";

    /** Language code for messages bundle, e.g. "en" or "ru". */
    public String language = "en";

    /** User id that always gets the highest music permission level. 0 disables it. */
    public long mainAdminId = 0L;

    /** Roles that raise a member above a plain user. */
    public List<AdminRole> adminRoles = new ArrayList<>();

    /** Music player limits and timings. */
    public MusicConfig music = new MusicConfig();

    public static class AdminRole {
        public long roleId;

        /** MODERATOR or ADMIN. */
        public PermissionLevel level = PermissionLevel.MODERATOR;

        public AdminRole() {}

        public AdminRole(long roleId, PermissionLevel level) {
            this.roleId = roleId;
            this.level = level;
        }
    }

    public static class MusicConfig {
        /** Tracks waiting in a session queue, the playing one not counted. */
        public int maxQueueSize = 100;

        public int defaultVolume = 50;

        /** Idle time after which a session that is not playing gets disconnected. */
        public long inactivityTimeoutSeconds = 300;

        /** How often the inactivity sweep runs. */
        public long inactivityCheckIntervalSeconds = 60;

        public long connectTimeoutSeconds = 10;

        public long resolveTimeoutSeconds = 30;

        /** Consecutive stream resolution failures tolerated before playback halts. */
        public int maxRetries = 3;

        public int historyLimit = 10;

        public int searchResults = 5;

        public int playlistLimit = 100;

        /** Prefix LavaPlayer uses for free text lookups, e.g. "scsearch:" or "ytsearch:". */
        public String searchPrefix = "scsearch:";

        public Duration inactivityTimeout() {
            return Duration.ofSeconds(inactivityTimeoutSeconds);
        }

        public Duration connectTimeout() {
            return Duration.ofSeconds(connectTimeoutSeconds);
        }

        public Duration resolveTimeout() {
            return Duration.ofSeconds(resolveTimeoutSeconds);
        }
    }

    /** Role id to level map with blank ids dropped; duplicates keep the higher level. */
    public Map<Long, PermissionLevel> roleLevels() {
        Map<Long, PermissionLevel> levels = new LinkedHashMap<>();
        for (AdminRole role : adminRoles) {
            if (role == null || role.roleId == 0L || role.level == null) continue;
            levels.merge(role.roleId, role.level, (a, b) -> a.compareTo(b) >= 0 ? a : b);
        }
        return levels;
    }

    /**
     * Maps the positional role list used by older configs: two full-access roles followed by one
     * limited role. Zero ids are skipped.
     */
    public static List<AdminRole> fromLegacyRoles(long... roleIds) {
        List<AdminRole> roles = new ArrayList<>();
        for (int i = 0; i < roleIds.length && i < 3; i++) {
            if (roleIds[i] == 0L) continue;
            roles.add(new AdminRole(roleIds[i], i < 2 ? PermissionLevel.ADMIN : PermissionLevel.MODERATOR));
        }
        return roles;
    }
}
