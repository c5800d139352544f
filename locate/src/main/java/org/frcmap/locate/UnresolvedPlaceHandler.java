package org.frcmap.locate;

/**
 * Notified when a record could not be located by any lookup tier.
 * The place strings collected this way are what an operator adds to the manual location file.
 */
public interface UnresolvedPlaceHandler {
   public void placeNotFound(String key, String placeName);
}
