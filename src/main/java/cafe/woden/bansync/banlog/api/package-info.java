@NamedInterface("api")
package cafe.woden.bansync.banlog.api;

import org.springframework.modulith.NamedInterface;
