package dev.clubhub.bot.module.music;

import dev.clubhub.bot.Lang;
import dev.clubhub.bot.module.music.model.LoopMode;
import dev.clubhub.bot.module.music.model.QueueItem;
import dev.clubhub.bot.module.music.queue.QueuePage;
import java.util.Optional;

public class PlayerTextUtil {

  /** {@code M:SS}, or {@code H:MM:SS} from one hour up. */
  public static String formatDuration(long seconds) {
    long hours = seconds / 3600;
    long minutes = (seconds % 3600) / 60;
    long rest = seconds % 60;
    if (hours > 0) return "%d:%02d:%02d".formatted(hours, minutes, rest);
    return "%d:%02d".formatted(minutes, rest);
  }

  /** {@code 1h 2m 3s}, leading zero units dropped. */
  public static String formatTotal(long seconds) {
    long hours = seconds / 3600;
    long minutes = (seconds % 3600) / 60;
    long rest = seconds % 60;
    if (hours > 0) return "%dh %dm %ds".formatted(hours, minutes, rest);
    if (minutes > 0) return "%dm %ds".formatted(minutes, rest);
    return "%ds".formatted(rest);
  }

  public static String friendlyMode(LoopMode mode) {
    return switch (mode == null ? LoopMode.NONE : mode) {
      case NONE -> Lang.get("music.mode.none");
      case TRACK -> Lang.get("music.mode.track");
      case QUEUE -> Lang.get("music.mode.queue");
    };
  }

  /** {@code #3 Artist - Title [3:25] (requester)} */
  public static String itemLine(QueueItem item) {
    return "#%d %s [%s] (%s)"
        .formatted(
            item.getPosition(),
            item.getTrack().getDisplayName(),
            item.getTrack().getDurationFormatted(),
            item.getRequesterName());
  }

  /** Now-playing line followed by one line per queued item and a page footer. */
  public static String describePage(Optional<QueueItem> current, QueuePage page, String totalDuration) {
    StringBuilder sb = new StringBuilder();
    current.ifPresent(item -> sb.append(Lang.get("music.queue.now_playing")).append(' ').append(itemLine(item)).append('\n'));
    if (page.items().isEmpty()) {
      sb.append(Lang.get("music.queue.empty")).append('\n');
    }
    for (QueueItem item : page.items()) {
      sb.append(itemLine(item)).append('\n');
    }
    sb.append(
        Lang.get("music.queue.footer")
            .formatted(page.page(), page.totalPages(), totalDuration));
    return sb.toString();
  }
}
