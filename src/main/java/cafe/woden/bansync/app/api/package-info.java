@NamedInterface("api")
package cafe.woden.bansync.app.api;

import org.springframework.modulith.NamedInterface;
