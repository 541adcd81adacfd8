@NamedInterface("api")
package cafe.woden.bansync.store.api;

import org.springframework.modulith.NamedInterface;
