@NamedInterface("api")
package cafe.woden.bansync.network.api;

import org.springframework.modulith.NamedInterface;
