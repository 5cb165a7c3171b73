/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.contentrec.online.generation;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.List;

import com.google.common.base.Charsets;

import net.contentrec.online.encoder.IDEncoder;
import net.contentrec.online.factorizer.FactorizationModel;

/**
 * <p>Simply prints the contents of a model version: its metadata, then each user's and each item's bias and
 * features.</p>
 *
 * <p>{@code java -cp ... net.contentrec.online.generation.PrintModelVersion [model root dir] ([version ID] ([out file]))}</p>
 *
 * <p>Without a version ID, the current version is printed. With no argument at all, the saved versions are
 * listed.</p>
 *
 * @author Sean Owen
 */
public final class PrintModelVersion {

  private PrintModelVersion() {
  }

  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      System.err.println("Usage: PrintModelVersion [model root dir] ([version ID] ([out file]))");
      return;
    }
    LocalModelRepository repository = new LocalModelRepository(new File(args[0]));
    File outFile = args.length > 2 ? new File(args[2]) : null;

    FactorizationModel model;
    if (args.length > 1) {
      model = ModelSerializer.read(new File(repository.getRootDir(), args[1]));
    } else {
      model = repository.current();
      if (model == null) {
        printVersions(repository.listVersions(), System.out);
        return;
      }
    }

    if (outFile == null) {
      print(model, System.out);
    } else {
      Writer out = new OutputStreamWriter(new FileOutputStream(outFile), Charsets.UTF_8);
      try {
        print(model, out);
      } finally {
        out.close();
      }
    }
  }

  static void printVersions(List<ModelVersion> versions, Appendable out) throws IOException {
    out.append("No current version. Saved versions:\n");
    for (ModelVersion version : versions) {
      out.append(version.toString()).append('\n');
    }
  }

  public static void print(FactorizationModel model, Appendable out) throws IOException {
    out.append("Version: ").append(model.getVersionID()).append('\n');
    out.append("Trained at: ").append(Long.toString(model.getTrainedAt())).append('\n');
    out.append("Features: ").append(Integer.toString(model.getEmbeddingDim())).append('\n');
    out.append("Global bias: ").append(Double.toString(model.getGlobalBias())).append('\n');
    out.append('\n');

    out.append("Users:\n");
    printFeatures(model.getUserEncoder(), model.getUserBiases(), model.getUserEmbeddings(), out);
    out.append('\n');

    out.append("Items:\n");
    printFeatures(model.getContentEncoder(), model.getContentBiases(), model.getContentEmbeddings(), out);
    out.append('\n');
  }

  private static void printFeatures(IDEncoder encoder,
                                    double[] biases,
                                    double[][] features,
                                    Appendable out) throws IOException {
    for (int i = 0; i < encoder.size(); i++) {
      StringBuilder line = new StringBuilder();
      line.append(encoder.inverse(i)).append('\t').append(biases[i]);
      for (double value : features[i]) {
        line.append('\t').append(value);
      }
      out.append(line).append('\n');
    }
  }

}
