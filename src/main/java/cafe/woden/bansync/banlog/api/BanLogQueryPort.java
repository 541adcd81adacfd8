package cafe.woden.bansync.banlog.api;

import java.util.List;
import org.jmolecules.architecture.layered.ApplicationLayer;

@ApplicationLayer
public interface BanLogQueryPort {

  /**
   * Up to {@code limit} records, newest {@link BanRecord#timestamp()} first.
   *
   * <p>Records sharing a timestamp keep their append order. An empty log yields an empty list.
   *
   * @throws IllegalArgumentException if {@code limit} is negative
   */
  List<BanRecord> recent(int limit);
}
