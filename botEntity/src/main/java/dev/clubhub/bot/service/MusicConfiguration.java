package dev.clubhub.bot.service;

import com.sedmelluq.discord.lavaplayer.container.MediaContainerRegistry;
import com.sedmelluq.discord.lavaplayer.format.StandardAudioDataFormats;
import com.sedmelluq.discord.lavaplayer.player.AudioConfiguration;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.player.DefaultAudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.source.bandcamp.BandcampAudioSourceManager;
import com.sedmelluq.discord.lavaplayer.source.http.HttpAudioSourceManager;
import com.sedmelluq.discord.lavaplayer.source.soundcloud.SoundCloudAudioSourceManager;
import com.sedmelluq.discord.lavaplayer.source.twitch.TwitchStreamAudioSourceManager;
import com.sedmelluq.discord.lavaplayer.source.vimeo.VimeoAudioSourceManager;
import dev.clubhub.bot.ClubBot;
import dev.clubhub.bot.config.ConfigurationFile;
import dev.clubhub.bot.module.music.permission.MemberDirectory;
import dev.clubhub.bot.module.music.permission.PermissionChecker;
import dev.clubhub.bot.module.music.player.MusicPlayer;
import dev.clubhub.bot.module.music.player.TrackResolver;
import dev.clubhub.bot.module.music.player.VoiceConnector;
import dev.clubhub.bot.module.music.player.lavaplayer.JdaMemberDirectory;
import dev.clubhub.bot.module.music.player.lavaplayer.LavaTrackResolver;
import dev.clubhub.bot.module.music.player.lavaplayer.LavaVoiceConnector;
import dev.clubhub.bot.module.music.player.lavaplayer.VoiceChannelWatcher;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.ChunkingFilter;
import net.dv8tion.jda.api.utils.MemberCachePolicy;
import net.dv8tion.jda.api.utils.cache.CacheFlag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the music core to JDA and LavaPlayer. */
@Slf4j
@Configuration
public class MusicConfiguration {

  @Bean
  public ConfigurationFile configurationFile() {
    return ClubBot.getConfig();
  }

  @Bean
  public ConfigurationFile.MusicConfig musicConfig(ConfigurationFile config) {
    return config.music;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "shutdown")
  public AudioPlayerManager audioPlayerManager() {
    AudioPlayerManager playerManager = new DefaultAudioPlayerManager();
    playerManager.getConfiguration().setResamplingQuality(AudioConfiguration.ResamplingQuality.HIGH);
    playerManager.getConfiguration().setOutputFormat(StandardAudioDataFormats.DISCORD_OPUS);

    playerManager.registerSourceManager(SoundCloudAudioSourceManager.createDefault());
    playerManager.registerSourceManager(new BandcampAudioSourceManager());
    playerManager.registerSourceManager(new VimeoAudioSourceManager());
    playerManager.registerSourceManager(new TwitchStreamAudioSourceManager());
    playerManager.registerSourceManager(new HttpAudioSourceManager(MediaContainerRegistry.DEFAULT_REGISTRY));
    return playerManager;
  }

  @Bean(destroyMethod = "shutdown")
  public JDA jda(ConfigurationFile config) throws InterruptedException {
    JDA jda =
        JDABuilder.createDefault(config.token, GatewayIntent.GUILD_VOICE_STATES, GatewayIntent.GUILD_MEMBERS)
            .enableCache(CacheFlag.VOICE_STATE)
            .setMemberCachePolicy(MemberCachePolicy.ALL)
            .setChunkingFilter(ChunkingFilter.ALL)
            .build();
    jda.awaitReady();
    log.info("Logged in as {}", jda.getSelfUser().getName());
    return jda;
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService resolverExecutor() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        4,
        r -> {
          Thread thread = new Thread(r, "music-resolver-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }

  @Bean
  public TrackResolver trackResolver(AudioPlayerManager playerManager, ConfigurationFile.MusicConfig music) {
    return new LavaTrackResolver(playerManager, music.searchPrefix, music.resolveTimeout());
  }

  @Bean
  public VoiceConnector voiceConnector(JDA jda, AudioPlayerManager playerManager) {
    return new LavaVoiceConnector(jda, playerManager);
  }

  @Bean
  public MemberDirectory memberDirectory(JDA jda) {
    return new JdaMemberDirectory(jda);
  }

  @Bean
  public PermissionChecker permissionChecker(ConfigurationFile config, MemberDirectory memberDirectory) {
    return new PermissionChecker(config.mainAdminId, config.roleLevels(), memberDirectory);
  }

  @Bean(destroyMethod = "shutdown")
  public MusicPlayer musicPlayer(
      VoiceConnector connector,
      TrackResolver resolver,
      ConfigurationFile.MusicConfig music,
      ExecutorService resolverExecutor,
      Clock clock) {
    return new MusicPlayer(connector, resolver, music, resolverExecutor, clock);
  }

  @Bean
  public VoiceChannelWatcher voiceChannelWatcher(JDA jda, MusicPlayer player) {
    VoiceChannelWatcher watcher = new VoiceChannelWatcher(player);
    jda.addEventListener(watcher);
    return watcher;
  }
}
