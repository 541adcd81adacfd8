@NamedInterface("api")
package cafe.woden.bansync.sync.api;

import org.springframework.modulith.NamedInterface;
