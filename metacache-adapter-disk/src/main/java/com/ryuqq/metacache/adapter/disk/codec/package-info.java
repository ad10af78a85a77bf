/**
 * Metadata codecs for the disk tier.
 */
package com.ryuqq.metacache.adapter.disk.codec;
