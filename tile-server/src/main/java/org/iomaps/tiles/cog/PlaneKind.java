/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.iomaps.tiles.cog;

/**
 * The role of an internal TIFF image.
 */
public enum PlaneKind {
  COLOR,
  // a transparency mask, flagged by bit 4 of NewSubfileType
  MASK;

  static final int MASK_BIT = 4;

  public static PlaneKind fromSubfileType(long newSubfileType) {
    return (newSubfileType & MASK_BIT) != 0 ? MASK : COLOR;
  }
}
