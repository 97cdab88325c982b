/*
 * Copyright 2022 devgianlu
 *
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

package xyz.gianlu.euph.metadata;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import xyz.gianlu.euph.profile.CompressionProfile;

import java.util.Objects;

/**
 * Everything known about a track besides its samples.
 *
 * @author devgianlu
 */
public final class Metadata {
    // Descriptive
    public final String title;
    public final String artist;
    public final String album;
    public final String genre;
    public final Integer year;
    public final Integer trackNumber;

    // Format
    /**
     * In seconds.
     */
    public final double duration;
    public final int sampleRate;
    public final int channelCount;
    public final int bitDepth;
    public final CompressionProfile encodingProfile;

    public final EnhancementData enhancementData;

    private Metadata(String title, String artist, String album, String genre, Integer year, Integer trackNumber,
                     double duration, int sampleRate, int channelCount, int bitDepth, CompressionProfile encodingProfile,
                     EnhancementData enhancementData) {
        this.title = title;
        this.artist = artist;
        this.album = album;
        this.genre = genre;
        this.year = year;
        this.trackNumber = trackNumber;
        this.duration = duration;
        this.sampleRate = sampleRate;
        this.channelCount = channelCount;
        this.bitDepth = bitDepth;
        this.encodingProfile = encodingProfile;
        this.enhancementData = enhancementData;
    }

    @NotNull
    public Builder toBuilder() {
        return new Builder()
                .setTitle(title)
                .setArtist(artist)
                .setAlbum(album)
                .setGenre(genre)
                .setYear(year)
                .setTrackNumber(trackNumber)
                .setDuration(duration)
                .setSampleRate(sampleRate)
                .setChannelCount(channelCount)
                .setBitDepth(bitDepth)
                .setEncodingProfile(encodingProfile)
                .setEnhancementData(enhancementData);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Metadata metadata = (Metadata) o;
        return Double.compare(metadata.duration, duration) == 0 && sampleRate == metadata.sampleRate
                && channelCount == metadata.channelCount && bitDepth == metadata.bitDepth
                && Objects.equals(title, metadata.title) && Objects.equals(artist, metadata.artist)
                && Objects.equals(album, metadata.album) && Objects.equals(genre, metadata.genre)
                && Objects.equals(year, metadata.year) && Objects.equals(trackNumber, metadata.trackNumber)
                && encodingProfile == metadata.encodingProfile && Objects.equals(enhancementData, metadata.enhancementData);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, artist, album, genre, year, trackNumber, duration, sampleRate, channelCount, bitDepth, encodingProfile, enhancementData);
    }

    @Override
    public String toString() {
        return "Metadata{title='" + title + "', artist='" + artist + "', album='" + album + "', genre='" + genre
                + "', year=" + year + ", trackNumber=" + trackNumber + ", duration=" + duration + ", sampleRate=" + sampleRate
                + ", channelCount=" + channelCount + ", bitDepth=" + bitDepth + ", encodingProfile=" + encodingProfile
                + ", enhancementData=" + enhancementData + '}';
    }

    public final static class Builder {
        private String title = null;
        private String artist = null;
        private String album = null;
        private String genre = null;
        private Integer year = null;
        private Integer trackNumber = null;
        private double duration = 0;
        private int sampleRate = 44100;
        private int channelCount = 2;
        private int bitDepth = 16;
        private CompressionProfile encodingProfile = CompressionProfile.BALANCED;
        private EnhancementData enhancementData = null;

        public Builder() {
        }

        public Builder setTitle(@Nullable String title) {
            this.title = title;
            return this;
        }

        public Builder setArtist(@Nullable String artist) {
            this.artist = artist;
            return this;
        }

        public Builder setAlbum(@Nullable String album) {
            this.album = album;
            return this;
        }

        public Builder setGenre(@Nullable String genre) {
            this.genre = genre;
            return this;
        }

        public Builder setYear(@Nullable Integer year) {
            this.year = year;
            return this;
        }

        public Builder setTrackNumber(@Nullable Integer trackNumber) {
            this.trackNumber = trackNumber;
            return this;
        }

        public Builder setDuration(double duration) {
            this.duration = duration;
            return this;
        }

        public Builder setSampleRate(int sampleRate) {
            this.sampleRate = sampleRate;
            return this;
        }

        public Builder setChannelCount(int channelCount) {
            this.channelCount = channelCount;
            return this;
        }

        public Builder setBitDepth(int bitDepth) {
            this.bitDepth = bitDepth;
            return this;
        }

        public Builder setEncodingProfile(@NotNull CompressionProfile encodingProfile) {
            this.encodingProfile = encodingProfile;
            return this;
        }

        public Builder setEnhancementData(@Nullable EnhancementData enhancementData) {
            this.enhancementData = enhancementData;
            return this;
        }

        @Contract(value = " -> new", pure = true)
        public @NotNull Metadata build() {
            return new Metadata(title, artist, album, genre, year, trackNumber, duration, sampleRate, channelCount, bitDepth, encodingProfile, enhancementData);
        }
    }
}
