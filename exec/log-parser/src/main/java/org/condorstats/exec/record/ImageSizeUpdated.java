/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.condorstats.exec.record;

import com.google.common.base.Preconditions;

public class ImageSizeUpdated {

  private final JobEvent event;

  private ImageSizeUpdated(JobEvent event) {
    this.event = event;
  }

  public static ImageSizeUpdated of(JobEvent event) {
    Preconditions.checkArgument(event.getType() == EventType.IMAGE_SIZE_UPDATED,
        "Not an image size event: %s", event);
    return new ImageSizeUpdated(event);
  }

  public JobEvent getEvent() { return event; }

  /**
   * @return the job's image size in KB
   */
  public long getImageSize() { return event.getFields().getLong("imageSize"); }
}
